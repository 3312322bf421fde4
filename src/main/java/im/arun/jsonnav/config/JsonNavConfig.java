package im.arun.jsonnav.config;

import lombok.Data;

@Data
public class JsonNavConfig {
    // document
    private long maxDocumentBytes = 500L * 1024 * 1024;
    private int maxDepth = 100;
    private boolean allowComments = true;
    private boolean allowTrailingCommas = true;

    // materialization
    private int childLimit = 1000;
    private int batchSize = 500;
    private int displayValueMaxLength = 100;

    // loading
    private int maxConcurrentLoads = 3;
    private long loadTimeoutMillis = 10_000;

    // memory
    private boolean memoryMonitorEnabled = true;
    private long samplingIntervalMillis = 2_000;
    private long warningThresholdBytes = 300L * 1024 * 1024;
    private long criticalThresholdBytes = 500L * 1024 * 1024;
    private int aggressiveAfterWarnings = 3;
    private long aggressiveCooldownMillis = 60_000;
    private long regularIdleMillis = 0;
    private int nodeCacheCapacity = 10_000;

    // search
    private int maxSearchResults = 1000;
    private int ngramSize = 3;
    private int ngramMinValueLength = 10;
    private long searchTimeoutMillis = 5_000;
    private int contextRadius = 20;

    // session journal, disabled when null
    private String journalDirectory;
}
