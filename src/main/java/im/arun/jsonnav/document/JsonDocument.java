package im.arun.jsonnav.document;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.model.PathSegment;
import lombok.Getter;

import java.util.Optional;

/**
 * A decoded JSON document, read-only for the lifetime of a session and safe to
 * share between threads.
 */
@Getter
public class JsonDocument {
    private final JsonNode root;
    private final String sourceName;
    private final long byteSize;

    JsonDocument(JsonNode root, String sourceName, long byteSize) {
        this.root = root;
        this.sourceName = sourceName;
        this.byteSize = byteSize;
    }

    /**
     * Navigates from the root by property names and array indexes.
     * A missing property, an out-of-range index or a segment that does not fit the
     * container kind resolves to empty; this never throws.
     */
    public Optional<JsonNode> resolve(NodePath path) {
        JsonNode current = root;
        for (PathSegment segment : path.segments()) {
            if (segment.isIndex()) {
                if (!current.isArray() || segment.getIndex() >= current.size()) {
                    return Optional.empty();
                }
                current = current.get(segment.getIndex());
            } else {
                if (!current.isObject()) {
                    return Optional.empty();
                }
                current = current.get(segment.getName());
            }
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }
}
