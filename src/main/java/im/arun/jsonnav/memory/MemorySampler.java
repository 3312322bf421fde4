package im.arun.jsonnav.memory;

/**
 * Source of the resident-memory figure the monitor evaluates.
 */
public interface MemorySampler {

    long usedBytes();
}
