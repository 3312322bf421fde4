package im.arun.jsonnav.model;

import lombok.Value;

/**
 * Snapshot reported by the memory monitor after every sample.
 */
@Value
public class MemoryStatus {
    MemoryLevel level;
    long residentBytes;
    int cacheSize;
    double cacheHitRate;
    long evictionCount;
    long timestamp;
}
