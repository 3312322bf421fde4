package im.arun.jsonnav;

/**
 * Base type for the navigation core's failures. Cancellation is reported
 * through {@link java.util.concurrent.CancellationException} instead.
 */
public class JsonNavException extends RuntimeException {

    public JsonNavException(String message) {
        super(message);
    }

    public JsonNavException(String message, Throwable cause) {
        super(message, cause);
    }
}
