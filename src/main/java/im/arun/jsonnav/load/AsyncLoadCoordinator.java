package im.arun.jsonnav.load;

import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.document.JsonDocument;
import im.arun.jsonnav.event.TreeEvent;
import im.arun.jsonnav.event.TreeEventBus;
import im.arun.jsonnav.memory.NodeCache;
import im.arun.jsonnav.model.ChildPage;
import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.LoadState;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.tree.TreeMaterializer;
import im.arun.jsonnav.util.CancellationSignal;
import im.arun.jsonnav.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Schedules child materialization off the caller's thread.
 *
 * <p>Requests for the same node are coalesced onto one in-flight load, at most
 * {@code maxConcurrentLoads} loads run at a time, and each caller gets its own
 * future that gives up after {@code loadTimeoutMillis} without stopping the load.
 */
public class AsyncLoadCoordinator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AsyncLoadCoordinator.class);
    private static final int PRELOAD_CHILDREN = 5;

    private final JsonDocument document;
    private final TreeMaterializer materializer;
    private final TreeEventBus events;
    private final NodeCache cache;
    private final int maxConcurrentLoads;
    private final long loadTimeoutMillis;
    private final int childLimit;
    private final LongSupplier clock;

    private final ConcurrentHashMap<NodePath, InFlightLoad> inFlight = new ConcurrentHashMap<>();
    private final ExecutorService loaders;
    private final ScheduledExecutorService timeouts;

    // guards closed and the commit of a finished load
    private final Object lifecycle = new Object();
    private volatile boolean closed;

    public AsyncLoadCoordinator(JsonDocument document, TreeMaterializer materializer, JsonNavConfig config,
                                TreeEventBus events, NodeCache cache) {
        this(document, materializer, config, events, cache, System::currentTimeMillis);
    }

    public AsyncLoadCoordinator(JsonDocument document, TreeMaterializer materializer, JsonNavConfig config,
                                TreeEventBus events, NodeCache cache, LongSupplier clock) {
        this.document = document;
        this.materializer = materializer;
        this.events = events;
        this.cache = cache;
        this.maxConcurrentLoads = config.getMaxConcurrentLoads();
        this.loadTimeoutMillis = config.getLoadTimeoutMillis();
        this.childLimit = config.getChildLimit();
        this.clock = clock;
        this.loaders = ExecutorProvider.newFixedPool("jsonnav-loader", maxConcurrentLoads);
        this.timeouts = ExecutorProvider.newScheduler("jsonnav-load-timeout");
    }

    /**
     * Loads the first page of a node's children.
     *
     * <p>A loaded node completes immediately with its children and a scalar with an
     * empty list. Otherwise the future completes with the children, or fails with
     * {@link NodeLoadException}, {@link CancellationException} or {@link LoadTimeoutException}.
     */
    public CompletableFuture<List<LazyNode>> expand(LazyNode node) {
        node.touch(clock.getAsLong());
        if (!node.isExpandable()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        return acquire(node, false);
    }

    /**
     * Appends the next page of children to a partially loaded node.
     * A node that has nothing loaded yet is expanded instead.
     */
    public CompletableFuture<List<LazyNode>> loadMore(LazyNode node) {
        node.touch(clock.getAsLong());
        if (!node.isExpandable()) {
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
        return acquire(node, true);
    }

    /**
     * Expands a node, then its first few expandable children in the background.
     * The returned future tracks the node itself only.
     */
    public CompletableFuture<List<LazyNode>> preloadDirectChildren(LazyNode node) {
        return expand(node).thenApply(children -> {
            int started = 0;
            for (LazyNode child : children) {
                if (started >= PRELOAD_CHILDREN) {
                    break;
                }
                if (child.isExpandable() && !child.isLoaded()) {
                    started++;
                    expand(child).whenComplete((loaded, error) -> {
                        if (error != null) {
                            logger.debug("Preload of {} did not complete: {}", child.getPath(), error.toString());
                        }
                    });
                }
            }
            return children;
        });
    }

    /**
     * Expands every node and reports, per path, whether its load succeeded.
     */
    public CompletableFuture<Map<NodePath, Boolean>> expandAll(Collection<LazyNode> nodes) {
        List<LazyNode> targets = new ArrayList<>(nodes);
        List<CompletableFuture<Boolean>> outcomes = new ArrayList<>(targets.size());
        for (LazyNode node : targets) {
            outcomes.add(expand(node).handle((children, error) -> error == null));
        }
        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0])).thenApply(ignored -> {
            Map<NodePath, Boolean> result = new LinkedHashMap<>();
            for (int i = 0; i < targets.size(); i++) {
                result.put(targets.get(i).getPath(), outcomes.get(i).join());
            }
            return result;
        });
    }

    /**
     * Signals the in-flight load of a node to stop at its next batch boundary.
     *
     * @return false if nothing was loading for the node
     */
    public boolean cancel(LazyNode node) {
        InFlightLoad load = inFlight.get(node.getPath());
        if (load == null) {
            return false;
        }
        load.signal.cancel();
        logger.debug("Cancellation requested for {}", node.getPath());
        return true;
    }

    public void cancelAll() {
        for (InFlightLoad load : inFlight.values()) {
            load.signal.cancel();
        }
    }

    public boolean isLoading(NodePath path) {
        return inFlight.containsKey(path);
    }

    public LoadStatus status() {
        int active = inFlight.size();
        return new LoadStatus(active, Math.max(0, maxConcurrentLoads - active), maxConcurrentLoads);
    }

    /**
     * Stops all loading. Every in-flight or queued load fails with
     * {@link CancellationException} and its node returns to idle; a load that
     * finishes afterwards is discarded.
     */
    @Override
    public void close() {
        List<InFlightLoad> abandoned;
        synchronized (lifecycle) {
            if (closed) {
                return;
            }
            closed = true;
            abandoned = new ArrayList<>(inFlight.values());
            inFlight.clear();
            for (InFlightLoad load : abandoned) {
                load.signal.cancel();
                load.node.cancelLoading();
            }
        }
        loaders.shutdownNow();
        timeouts.shutdownNow();

        for (InFlightLoad load : abandoned) {
            load.result.completeExceptionally(new CancellationException("Load coordinator is closed"));
        }
        if (!abandoned.isEmpty()) {
            logger.info("Closed with {} loads outstanding", abandoned.size());
        }
    }

    private CompletableFuture<List<LazyNode>> acquire(LazyNode node, boolean more) {
        if (closed) {
            return CompletableFuture.failedFuture(new CancellationException("Load coordinator is closed"));
        }
        NodePath path = node.getPath();
        while (true) {
            InFlightLoad existing = inFlight.get(path);
            if (existing != null) {
                return callerView(existing);
            }

            LoadState state = node.getLoadState();
            if (state == LoadState.LOADED && !(more && node.isPartial())) {
                return CompletableFuture.completedFuture(node.getChildren());
            }
            boolean nextPage = more && state == LoadState.LOADED;

            boolean[] created = {false};
            InFlightLoad load = inFlight.computeIfAbsent(path, p -> {
                boolean started = nextPage ? node.beginLoadingMore() : node.beginLoading();
                if (!started) {
                    return null;
                }
                created[0] = true;
                return new InFlightLoad(node, nextPage);
            });

            if (load != null) {
                if (created[0]) {
                    submit(load);
                }
                return callerView(load);
            }
            // the node changed state between the checks; re-read it
            Thread.yield();
        }
    }

    private void submit(InFlightLoad load) {
        try {
            loaders.execute(() -> run(load));
        } catch (RejectedExecutionException e) {
            load.node.cancelLoading();
            inFlight.remove(load.node.getPath(), load);
            load.result.completeExceptionally(new CancellationException("Load coordinator is closed"));
        }
    }

    private void run(InFlightLoad load) {
        LazyNode node = load.node;
        NodePath path = node.getPath();
        try {
            load.signal.throwIfCancelled();
            int offset = load.nextPage ? node.getLoadedChildCount() : 0;
            ChildPage page = materializer.materializeChildren(document, node, offset, childLimit, load.signal);

            synchronized (lifecycle) {
                if (closed) {
                    throw new CancellationException("Load coordinator is closed");
                }
                load.signal.throwIfCancelled();
                if (load.nextPage) {
                    node.completeLoadingMore(page.getChildren(), page.isPartial());
                } else {
                    node.completeLoading(page.getChildren(), page.isPartial());
                }
                cache.putAll(page.getChildren());
                inFlight.remove(path, load);
            }

            List<LazyNode> children = node.getChildren();
            events.publish(new TreeEvent.ChildrenLoaded(node, page.getChildren(), page.isPartial(), clock.getAsLong()));
            load.result.complete(children);
        } catch (CancellationException e) {
            synchronized (lifecycle) {
                if (inFlight.remove(path, load)) {
                    node.cancelLoading();
                }
            }
            logger.info("Load of {} cancelled", path);
            events.publish(new TreeEvent.NodeUpdated(node, clock.getAsLong()));
            load.result.completeExceptionally(e);
        } catch (RuntimeException e) {
            synchronized (lifecycle) {
                if (inFlight.remove(path, load)) {
                    node.failLoading(e);
                }
            }
            logger.error("Failed to load children of {}", path, e);
            events.publish(new TreeEvent.NodeUpdated(node, clock.getAsLong()));
            load.result.completeExceptionally(new NodeLoadException(path, e));
        }
    }

    /**
     * A per-caller future over the shared load, failing with {@link LoadTimeoutException}
     * once the caller's wait exceeds the timeout.
     */
    private CompletableFuture<List<LazyNode>> callerView(InFlightLoad load) {
        CompletableFuture<List<LazyNode>> view = new CompletableFuture<>();
        load.result.whenComplete((children, error) -> {
            if (error == null) {
                view.complete(children);
            } else {
                view.completeExceptionally(unwrap(error));
            }
        });

        if (!view.isDone()) {
            NodePath path = load.node.getPath();
            ScheduledFuture<?> timer = timeouts.schedule(() -> {
                if (view.completeExceptionally(new LoadTimeoutException(path, loadTimeoutMillis))) {
                    logger.warn("Caller gave up waiting for {} after {} ms; load continues", path, loadTimeoutMillis);
                }
            }, loadTimeoutMillis, TimeUnit.MILLISECONDS);
            view.whenComplete((children, error) -> timer.cancel(false));
        }
        return view;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static final class InFlightLoad {
        final LazyNode node;
        final boolean nextPage;
        final CancellationSignal signal = new CancellationSignal();
        final CompletableFuture<List<LazyNode>> result = new CompletableFuture<>();

        InFlightLoad(LazyNode node, boolean nextPage) {
            this.node = node;
            this.nextPage = nextPage;
        }
    }
}
