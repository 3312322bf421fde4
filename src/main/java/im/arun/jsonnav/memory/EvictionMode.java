package im.arun.jsonnav.memory;

public enum EvictionMode {
    /** Only nodes idle for the configured period. */
    REGULAR,
    /** Every collapsed loaded node, regardless of recency. */
    AGGRESSIVE,
    /** As aggressive, followed by a cache flush and a reclaim request. */
    EMERGENCY
}
