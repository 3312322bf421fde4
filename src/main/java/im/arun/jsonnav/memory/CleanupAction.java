package im.arun.jsonnav.memory;

public enum CleanupAction {
    NONE,
    REGULAR_CLEANUP,
    AGGRESSIVE_CLEANUP,
    EMERGENCY_CLEANUP;

    public EvictionMode evictionMode() {
        switch (this) {
            case REGULAR_CLEANUP:
                return EvictionMode.REGULAR;
            case AGGRESSIVE_CLEANUP:
                return EvictionMode.AGGRESSIVE;
            case EMERGENCY_CLEANUP:
                return EvictionMode.EMERGENCY;
            default:
                return null;
        }
    }
}
