package im.arun.jsonnav.model;

/**
 * Per-node loading state. A cancelled load goes back to {@link #IDLE};
 * eviction takes a {@link #LOADED} node back to {@link #IDLE} as well.
 */
public enum LoadState {
    IDLE,
    LOADING,
    LOADED,
    FAILED
}
