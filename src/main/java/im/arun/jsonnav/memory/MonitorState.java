package im.arun.jsonnav.memory;

import lombok.Value;

/**
 * Escalation state carried between samples.
 */
@Value
public class MonitorState {
    public static final long NEVER = -1;

    int consecutiveWarnings;
    long lastAggressiveCleanupMillis;

    public static MonitorState initial() {
        return new MonitorState(0, NEVER);
    }
}
