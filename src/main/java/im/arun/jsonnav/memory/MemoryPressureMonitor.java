package im.arun.jsonnav.memory;

import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.event.TreeEvent;
import im.arun.jsonnav.event.TreeEventBus;
import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.MemoryLevel;
import im.arun.jsonnav.model.MemoryStatus;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.util.ExecutorProvider;
import im.arun.jsonnav.util.FileSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically samples memory use and releases collapsed subtrees when the
 * policy asks for it. A failing sample or sweep is logged and the next cycle
 * proceeds normally.
 */
public class MemoryPressureMonitor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MemoryPressureMonitor.class);

    private final long samplingIntervalMillis;
    private final MemorySampler sampler;
    private final MemoryPolicy policy;
    private final NodeEvictor evictor;
    private final NodeCache cache;
    private final TreeEventBus events;
    private final Supplier<LazyNode> rootSupplier;
    private final Supplier<NodePath> focusSupplier;
    private volatile Runnable reclaimAction = System::gc;

    private MonitorState state = MonitorState.initial();
    private MemoryLevel level = MemoryLevel.NORMAL;
    private long residentBytes;
    private long evictionCount;
    private long lastSampleMillis;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public MemoryPressureMonitor(JsonNavConfig config, MemorySampler sampler, NodeCache cache,
                                 TreeEventBus events, Supplier<LazyNode> rootSupplier,
                                 Supplier<NodePath> focusSupplier) {
        this(config, sampler, new MemoryPolicy(config), new NodeEvictor(config.getRegularIdleMillis(), cache),
            cache, events, rootSupplier, focusSupplier);
    }

    public MemoryPressureMonitor(JsonNavConfig config, MemorySampler sampler, MemoryPolicy policy,
                                 NodeEvictor evictor, NodeCache cache, TreeEventBus events,
                                 Supplier<LazyNode> rootSupplier, Supplier<NodePath> focusSupplier) {
        this.samplingIntervalMillis = config.getSamplingIntervalMillis();
        this.sampler = sampler;
        this.policy = policy;
        this.evictor = evictor;
        this.cache = cache;
        this.events = events;
        this.rootSupplier = rootSupplier;
        this.focusSupplier = focusSupplier;
    }

    /**
     * Replaces the host reclaim request issued after an emergency sweep.
     */
    public void setReclaimAction(Runnable reclaimAction) {
        this.reclaimAction = reclaimAction;
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        scheduler = ExecutorProvider.newScheduler("jsonnav-memory");
        task = scheduler.scheduleAtFixedRate(this::tick, samplingIntervalMillis, samplingIntervalMillis,
            TimeUnit.MILLISECONDS);
        logger.info("Memory monitor started, sampling every {} ms", samplingIntervalMillis);
    }

    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        scheduler.shutdownNow();
        task = null;
        scheduler = null;
        logger.info("Memory monitor stopped");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    @Override
    public void close() {
        stop();
    }

    private void tick() {
        try {
            sampleOnce(System.currentTimeMillis());
        } catch (RuntimeException e) {
            // a thrown exception would cancel the periodic task
            logger.error("Memory monitor cycle failed", e);
        }
    }

    /**
     * Runs one sampling cycle: sample, evaluate, clean up, report.
     */
    public MemoryStatus sampleOnce(long now) {
        long used;
        try {
            used = sampler.usedBytes();
        } catch (RuntimeException e) {
            logger.error("Memory sampling failed", e);
            return status();
        }

        MemoryPolicy.Decision decision;
        MemoryLevel previous;
        synchronized (this) {
            decision = policy.evaluate(now, used, state);
            previous = level;
            state = decision.getState();
            level = decision.getLevel();
            residentBytes = used;
            lastSampleMillis = now;
        }

        if (previous != decision.getLevel()) {
            logger.warn("Memory level {} -> {} ({} in use)", previous, decision.getLevel(), FileSizes.readable(used));
        }

        List<NodePath> evicted = cleanup(decision.getAction(), now);
        MemoryStatus status;
        synchronized (this) {
            evictionCount += evicted.size();
            status = currentStatus();
        }

        events.publish(new TreeEvent.MemoryLevelChanged(previous, status));
        if (!evicted.isEmpty()) {
            events.publish(new TreeEvent.NodesEvicted(evicted, now));
        }
        return status;
    }

    private List<NodePath> cleanup(CleanupAction action, long now) {
        if (action == CleanupAction.NONE) {
            return Collections.emptyList();
        }

        List<NodePath> evicted = Collections.emptyList();
        try {
            LazyNode root = rootSupplier.get();
            if (root != null) {
                evicted = evictor.sweep(root, action.evictionMode(), now, focusSupplier.get());
            }
        } catch (RuntimeException e) {
            logger.error("{} failed", action, e);
        }

        if (action == CleanupAction.EMERGENCY_CLEANUP) {
            cache.clear();
            try {
                reclaimAction.run();
            } catch (RuntimeException e) {
                logger.error("Reclaim request failed", e);
            }
            logger.warn("Emergency cleanup released {} subtrees and flushed the node cache", evicted.size());
        }
        return evicted;
    }

    public synchronized MemoryStatus status() {
        return currentStatus();
    }

    public synchronized MemoryLevel level() {
        return level;
    }

    public synchronized MonitorState state() {
        return state;
    }

    private MemoryStatus currentStatus() {
        return new MemoryStatus(level, residentBytes, cache.size(), cache.hitRate(), evictionCount, lastSampleMillis);
    }
}
