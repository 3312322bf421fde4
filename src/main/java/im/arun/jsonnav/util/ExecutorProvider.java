package im.arun.jsonnav.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides the thread pools used by the navigation core. All threads are named
 * daemon threads so an embedding host never hangs on exit.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService instance;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Returns the shared worker pool for CPU-bound work (parse, analyze, index, search).
     * Sized to the available processors, capped at 8.
     */
    public static ExecutorService getExecutor() {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    int poolSize = Math.max(2, Math.min(Runtime.getRuntime().availableProcessors(), 8));
                    instance = Executors.newFixedThreadPool(poolSize, namedDaemonThreads("jsonnav-worker"));
                }
            }
        }
        return instance;
    }

    /**
     * Creates a dedicated fixed-size pool; the caller owns its lifecycle.
     */
    public static ExecutorService newFixedPool(String name, int size) {
        return Executors.newFixedThreadPool(size, namedDaemonThreads(name));
    }

    /**
     * Creates a single-thread scheduler whose cancelled tasks are removed eagerly.
     */
    public static ScheduledExecutorService newScheduler(String name) {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, namedDaemonThreads(name));
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    public static ThreadFactory namedDaemonThreads(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }
        };
    }

    /**
     * Shuts down the shared executor. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
            }
        }
    }
}
