package im.arun.jsonnav.memory;

import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.model.MemoryLevel;
import lombok.Value;

/**
 * Maps a memory sample and the escalation state to a level and a cleanup action.
 * Pure: no clock, no side effects.
 */
public class MemoryPolicy {
    private final long warningThresholdBytes;
    private final long criticalThresholdBytes;
    private final int aggressiveAfterWarnings;
    private final long aggressiveCooldownMillis;

    public MemoryPolicy(JsonNavConfig config) {
        this(config.getWarningThresholdBytes(), config.getCriticalThresholdBytes(),
            config.getAggressiveAfterWarnings(), config.getAggressiveCooldownMillis());
    }

    public MemoryPolicy(long warningThresholdBytes, long criticalThresholdBytes,
                        int aggressiveAfterWarnings, long aggressiveCooldownMillis) {
        if (criticalThresholdBytes < warningThresholdBytes) {
            throw new IllegalArgumentException("Critical threshold below warning threshold");
        }
        this.warningThresholdBytes = warningThresholdBytes;
        this.criticalThresholdBytes = criticalThresholdBytes;
        this.aggressiveAfterWarnings = aggressiveAfterWarnings;
        this.aggressiveCooldownMillis = aggressiveCooldownMillis;
    }

    public Decision evaluate(long now, long usedBytes, MonitorState state) {
        if (usedBytes > criticalThresholdBytes) {
            MonitorState next = new MonitorState(state.getConsecutiveWarnings() + 1, now);
            return new Decision(next, MemoryLevel.CRITICAL, CleanupAction.EMERGENCY_CLEANUP);
        }

        if (usedBytes > warningThresholdBytes) {
            int warnings = state.getConsecutiveWarnings() + 1;
            long last = state.getLastAggressiveCleanupMillis();
            boolean cooledDown = last == MonitorState.NEVER || now - last > aggressiveCooldownMillis;
            if (warnings >= aggressiveAfterWarnings && cooledDown) {
                return new Decision(new MonitorState(warnings, now), MemoryLevel.WARNING, CleanupAction.AGGRESSIVE_CLEANUP);
            }
            return new Decision(new MonitorState(warnings, last), MemoryLevel.WARNING, CleanupAction.REGULAR_CLEANUP);
        }

        return new Decision(new MonitorState(0, state.getLastAggressiveCleanupMillis()),
            MemoryLevel.NORMAL, CleanupAction.NONE);
    }

    @Value
    public static class Decision {
        MonitorState state;
        MemoryLevel level;
        CleanupAction action;
    }
}
