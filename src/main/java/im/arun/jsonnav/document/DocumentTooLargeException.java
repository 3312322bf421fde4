package im.arun.jsonnav.document;

import lombok.Getter;

/**
 * The input exceeds the configured size cap. Raised before any decoding starts.
 */
@Getter
public class DocumentTooLargeException extends DocumentParseException {
    private final long size;
    private final long limit;

    public DocumentTooLargeException(long size, long limit) {
        super(Reason.SIZE_EXCEEDED,
            String.format("Document is %d bytes, larger than the %d byte limit", size, limit), -1, null);
        this.size = size;
        this.limit = limit;
    }
}
