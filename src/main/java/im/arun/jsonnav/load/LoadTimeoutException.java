package im.arun.jsonnav.load;

import im.arun.jsonnav.JsonNavException;
import im.arun.jsonnav.model.NodePath;
import lombok.Getter;

/**
 * The caller stopped waiting for a load. The load itself keeps running and
 * still populates the node.
 */
@Getter
public class LoadTimeoutException extends JsonNavException {
    private final NodePath path;
    private final long timeoutMillis;

    public LoadTimeoutException(NodePath path, long timeoutMillis) {
        super("Loading " + path.toJsonPath() + " did not finish within " + timeoutMillis + " ms");
        this.path = path;
        this.timeoutMillis = timeoutMillis;
    }
}
