package im.arun.jsonnav.model;

public enum MemoryLevel {
    NORMAL,
    WARNING,
    CRITICAL
}
