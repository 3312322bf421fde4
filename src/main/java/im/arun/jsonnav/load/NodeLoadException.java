package im.arun.jsonnav.load;

import im.arun.jsonnav.JsonNavException;
import im.arun.jsonnav.model.NodePath;
import lombok.Getter;

@Getter
public class NodeLoadException extends JsonNavException {
    private final NodePath path;

    public NodeLoadException(NodePath path, Throwable cause) {
        super("Failed to load children of " + path.toJsonPath() + ": " + cause.getMessage(), cause);
        this.path = path;
    }
}
