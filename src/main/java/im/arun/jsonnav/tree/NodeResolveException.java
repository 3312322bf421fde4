package im.arun.jsonnav.tree;

import im.arun.jsonnav.JsonNavException;
import im.arun.jsonnav.model.NodePath;
import lombok.Getter;

/**
 * A node's path no longer resolves in its document. Affects only that node.
 */
@Getter
public class NodeResolveException extends JsonNavException {
    private final NodePath path;

    public NodeResolveException(NodePath path) {
        super("Path no longer resolves: " + path.toJsonPath());
        this.path = path;
    }
}
