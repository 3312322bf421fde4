package im.arun.jsonnav.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.jsonnav.document.JsonDocument;
import im.arun.jsonnav.model.StructureInfo;
import im.arun.jsonnav.util.CancellationSignal;
import im.arun.jsonnav.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.concurrent.CompletableFuture;

/**
 * Computes {@link StructureInfo} in one depth-first pass over the decoded document.
 * Only counters are accumulated; auxiliary space is the recursion stack.
 */
public class StructureAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(StructureAnalyzer.class);
    private static final int CANCEL_CHECK_INTERVAL = 4096;

    public StructureInfo analyze(JsonDocument document) {
        return analyze(document, CancellationSignal.none());
    }

    /**
     * @throws java.util.concurrent.CancellationException if cancelled; no partial result is returned
     */
    public StructureInfo analyze(JsonDocument document, CancellationSignal signal) {
        signal.throwIfCancelled();
        long start = System.currentTimeMillis();
        Counters counters = new Counters(signal);
        visit(document.getRoot(), 0, counters);

        StructureInfo info = StructureInfo.builder()
            .totalNodes(counters.totalNodes)
            .objectCount(counters.objectCount)
            .arrayCount(counters.arrayCount)
            .stringCount(counters.stringCount)
            .numberCount(counters.numberCount)
            .booleanCount(counters.booleanCount)
            .nullCount(counters.nullCount)
            .propertyCount(counters.propertyCount)
            .arrayItemCount(counters.arrayItemCount)
            .maxDepth(counters.maxDepth)
            .maxArrayLength(counters.maxArrayLength)
            .totalStringLength(counters.totalStringLength)
            .maxStringLength(counters.maxStringLength)
            .byteSize(document.getByteSize())
            .build();

        logger.info("Analyzed {} in {} ms: {}", document.getSourceName(), System.currentTimeMillis() - start, info.summary());
        return info;
    }

    public CompletableFuture<StructureInfo> analyzeAsync(JsonDocument document, CancellationSignal signal) {
        return CompletableFuture.supplyAsync(() -> analyze(document, signal), ExecutorProvider.getExecutor());
    }

    private void visit(JsonNode element, int depth, Counters stats) {
        stats.visited(depth);

        if (element.isObject()) {
            stats.objectCount++;
            Iterator<JsonNode> values = element.elements();
            while (values.hasNext()) {
                stats.propertyCount++;
                visit(values.next(), depth + 1, stats);
            }
        } else if (element.isArray()) {
            stats.arrayCount++;
            int length = element.size();
            stats.arrayItemCount += length;
            stats.maxArrayLength = Math.max(stats.maxArrayLength, length);
            for (int i = 0; i < length; i++) {
                visit(element.get(i), depth + 1, stats);
            }
        } else if (element.isNumber()) {
            stats.numberCount++;
        } else if (element.isBoolean()) {
            stats.booleanCount++;
        } else if (element.isNull()) {
            stats.nullCount++;
        } else {
            stats.stringCount++;
            int length = element.asText().length();
            stats.totalStringLength += length;
            stats.maxStringLength = Math.max(stats.maxStringLength, length);
        }
    }

    private static final class Counters {
        private final CancellationSignal signal;
        long totalNodes;
        long objectCount;
        long arrayCount;
        long stringCount;
        long numberCount;
        long booleanCount;
        long nullCount;
        long propertyCount;
        long arrayItemCount;
        int maxDepth;
        int maxArrayLength;
        long totalStringLength;
        int maxStringLength;

        Counters(CancellationSignal signal) {
            this.signal = signal;
        }

        void visited(int depth) {
            totalNodes++;
            if (depth > maxDepth) {
                maxDepth = depth;
            }
            if (totalNodes % CANCEL_CHECK_INTERVAL == 0) {
                signal.throwIfCancelled();
            }
        }
    }
}
