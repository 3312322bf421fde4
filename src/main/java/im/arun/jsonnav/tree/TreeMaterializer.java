package im.arun.jsonnav.tree;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.document.JsonDocument;
import im.arun.jsonnav.model.ChildPage;
import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.NodeKind;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.util.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Produces the immediate children of a node from the decoded document.
 * Grandchildren are never built: each child only records its own cardinality,
 * so one call costs O(children produced), not O(subtree).
 */
public class TreeMaterializer {
    private static final Logger logger = LoggerFactory.getLogger(TreeMaterializer.class);
    public static final String ROOT_KEY = "root";

    private final int defaultLimit;
    private final int batchSize;
    private final int displayValueMaxLength;
    private final LongSupplier clock;

    public TreeMaterializer(JsonNavConfig config) {
        this(config, System::currentTimeMillis);
    }

    public TreeMaterializer(JsonNavConfig config, LongSupplier clock) {
        this.defaultLimit = config.getChildLimit();
        this.batchSize = Math.max(1, config.getBatchSize());
        this.displayValueMaxLength = config.getDisplayValueMaxLength();
        this.clock = clock;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public LazyNode createRoot(JsonDocument document) {
        return createNode(null, NodePath.root(), ROOT_KEY, document.getRoot(), clock.getAsLong());
    }

    /**
     * Materializes up to {@code limit} children of the value at {@code path}, without parent links.
     */
    public ChildPage materializeChildren(JsonDocument document, NodePath path, int limit) {
        return materialize(document, path, null, 0, limit, CancellationSignal.none());
    }

    public ChildPage materializeChildren(JsonDocument document, NodePath path, int offset, int limit,
                                         CancellationSignal signal) {
        return materialize(document, path, null, offset, limit, signal);
    }

    /**
     * Materializes the window {@code [offset, offset + limit)} of {@code parent}'s children.
     * Cancellation is observed between batches.
     *
     * @throws NodeResolveException if the parent's path no longer resolves
     */
    public ChildPage materializeChildren(JsonDocument document, LazyNode parent, int offset, int limit,
                                         CancellationSignal signal) {
        return materialize(document, parent.getPath(), parent, offset, limit, signal);
    }

    private ChildPage materialize(JsonDocument document, NodePath path, LazyNode parent,
                                  int offset, int limit, CancellationSignal signal) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Child limit must be positive: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }

        JsonNode element = document.resolve(path).orElseThrow(() -> new NodeResolveException(path));
        int total = element.isContainerNode() ? element.size() : 0;
        if (total == 0 || offset >= total) {
            return new ChildPage(Collections.emptyList(), offset, total, false);
        }

        int end = (int) Math.min((long) offset + limit, total);
        List<LazyNode> children = new ArrayList<>(end - offset);
        long now = clock.getAsLong();

        if (element.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
            for (int skipped = 0; skipped < offset && fields.hasNext(); skipped++) {
                fields.next();
            }
            for (int i = offset; i < end && fields.hasNext(); i++) {
                if ((i - offset) % batchSize == 0) {
                    signal.throwIfCancelled();
                }
                Map.Entry<String, JsonNode> field = fields.next();
                children.add(createNode(parent, path.child(field.getKey()), field.getKey(), field.getValue(), now));
            }
        } else {
            for (int i = offset; i < end; i++) {
                if ((i - offset) % batchSize == 0) {
                    signal.throwIfCancelled();
                }
                NodePath childPath = path.child(i);
                children.add(createNode(parent, childPath, childPath.lastSegment().label(), element.get(i), now));
            }
        }

        boolean partial = end < total;
        if (partial) {
            logger.debug("Materialized {} of {} children at {}", end - offset, total, path);
        }
        return new ChildPage(children, offset, total, partial);
    }

    private LazyNode createNode(LazyNode parent, NodePath path, String key, JsonNode value, long now) {
        NodeKind kind = NodeKind.of(value);
        int childCount = kind.isContainer() ? value.size() : 0;
        String display = ValueFormatter.displayValue(value, displayValueMaxLength);
        return new LazyNode(parent, path, key, kind, display, childCount, value, now);
    }
}
