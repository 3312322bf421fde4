package im.arun.jsonnav.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate statistics of a decoded document, computed once per document.
 */
@Value
@Builder
public class StructureInfo {
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
    long byteSize;

    public String summary() {
        return String.format(
            "Total nodes: %d, objects: %d, arrays: %d, strings: %d, numbers: %d, booleans: %d, nulls: %d, max depth: %d",
            totalNodes, objectCount, arrayCount, stringCount, numberCount, booleanCount, nullCount, maxDepth);
    }
}
