package im.arun.jsonnav.document;

import im.arun.jsonnav.JsonNavException;
import lombok.Getter;

/**
 * The document could not be opened. No partial document is retained.
 */
@Getter
public class DocumentParseException extends JsonNavException {

    public enum Reason {
        MALFORMED,
        DEPTH_EXCEEDED,
        SIZE_EXCEEDED
    }

    private final Reason reason;
    /** Byte offset of the failure in the input, or -1 when unknown. */
    private final long byteOffset;

    public DocumentParseException(Reason reason, String message, long byteOffset, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.byteOffset = byteOffset;
    }
}
