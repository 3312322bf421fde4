package im.arun.jsonnav.load;

import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.document.DocumentParser;
import im.arun.jsonnav.document.JsonDocument;
import im.arun.jsonnav.event.TreeEvent;
import im.arun.jsonnav.event.TreeEventBus;
import im.arun.jsonnav.memory.NodeCache;
import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.LoadState;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.tree.TreeMaterializer;
import im.arun.jsonnav.util.CancellationSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class AsyncLoadCoordinatorTest {

    private JsonNavConfig config;
    private DocumentParser parser;
    private TreeMaterializer materializer;
    private TreeEventBus events;
    private NodeCache cache;
    private AsyncLoadCoordinator coordinator;

    @BeforeEach
    void setUp() {
        config = new JsonNavConfig();
        config.setLoadTimeoutMillis(5_000);
        parser = new DocumentParser(config);
        materializer = spy(new TreeMaterializer(config));
        events = new TreeEventBus();
        cache = new NodeCache(1000);
    }

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    private JsonDocument open(String json) {
        JsonDocument document = parser.parse(json.getBytes(StandardCharsets.UTF_8), "load.json");
        coordinator = new AsyncLoadCoordinator(document, materializer, config, events, cache);
        return document;
    }

    private LazyNode root(JsonDocument document) {
        return materializer.createRoot(document);
    }

    /**
     * Makes every materialization wait for {@code release} after counting down {@code started}.
     */
    private void blockMaterialization(CountDownLatch started, CountDownLatch release) {
        doAnswer(invocation -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return invocation.callRealMethod();
        }).when(materializer).materializeChildren(any(JsonDocument.class), any(LazyNode.class), anyInt(), anyInt(),
            any(CancellationSignal.class));
    }

    private void verifyMaterializations(int count) {
        verify(materializer, times(count)).materializeChildren(any(JsonDocument.class), any(LazyNode.class),
            anyInt(), anyInt(), any(CancellationSignal.class));
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Condition not met within 5 s");
            }
            Thread.sleep(10);
        }
    }

    @Test
    void expandLoadsChildrenAndCachesThem() {
        LazyNode root = root(open("{\"a\":1,\"b\":[1,2]}"));

        List<LazyNode> children = coordinator.expand(root).join();

        assertThat(children).extracting(LazyNode::getKey).containsExactly("a", "b");
        assertThat(root.getLoadState()).isEqualTo(LoadState.LOADED);
        assertThat(cache.get(NodePath.root().child("b"))).isSameAs(children.get(1));
    }

    @Test
    void loadedNodeCompletesImmediately() {
        LazyNode root = root(open("[1,2,3]"));
        coordinator.expand(root).join();

        CompletableFuture<List<LazyNode>> again = coordinator.expand(root);

        assertThat(again).isCompleted();
        assertThat(again.join()).hasSize(3);
        verifyMaterializations(1);
    }

    @Test
    void scalarCompletesWithNoChildren() {
        JsonDocument document = open("{\"s\":\"x\",\"e\":{}}");
        LazyNode root = root(document);
        List<LazyNode> children = coordinator.expand(root).join();

        assertThat(coordinator.expand(children.get(0)).join()).isEmpty();
        assertThat(coordinator.expand(children.get(1)).join()).isEmpty();
        verifyMaterializations(1);
    }

    @Test
    void concurrentRequestsShareOneLoad() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        blockMaterialization(started, release);
        LazyNode root = root(open("{\"a\":1,\"b\":2,\"c\":3}"));

        CompletableFuture<List<LazyNode>> first = coordinator.expand(root);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<List<LazyNode>> second = coordinator.expand(root);
        assertThat(coordinator.isLoading(root.getPath())).isTrue();
        release.countDown();

        List<LazyNode> firstChildren = first.get(5, TimeUnit.SECONDS);
        List<LazyNode> secondChildren = second.get(5, TimeUnit.SECONDS);

        assertThat(firstChildren).hasSize(3);
        assertThat(secondChildren).isSameAs(firstChildren);
        verifyMaterializations(1);
    }

    @Test
    void callerTimesOutWhileLoadStillPopulatesNode() throws Exception {
        config.setLoadTimeoutMillis(100);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        blockMaterialization(started, release);
        LazyNode root = root(open("[1,2]"));

        CompletableFuture<List<LazyNode>> future = coordinator.expand(root);

        assertThatThrownBy(future::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(LoadTimeoutException.class);
        assertThat(root.getLoadState()).isEqualTo(LoadState.LOADING);

        release.countDown();
        waitUntil(root::isLoaded);

        assertThat(root.getChildren()).hasSize(2);
        assertThat(coordinator.expand(root).join()).hasSize(2);
        verifyMaterializations(1);
    }

    @Test
    void cancelledLoadReturnsNodeToIdle() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        blockMaterialization(started, release);
        LazyNode root = root(open("[1,2,3]"));
        BlockingQueue<TreeEvent> received = events.subscribeQueue();

        CompletableFuture<List<LazyNode>> future = coordinator.expand(root);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(coordinator.cancel(root)).isTrue();
        release.countDown();

        assertThatThrownBy(future::join).isInstanceOf(CancellationException.class);
        waitUntil(() -> !coordinator.isLoading(root.getPath()));
        assertThat(root.getLoadState()).isEqualTo(LoadState.IDLE);
        assertThat(root.getFailure()).isNull();
        assertThat(received.poll(5, TimeUnit.SECONDS)).isInstanceOf(TreeEvent.NodeUpdated.class);

        assertThat(coordinator.expand(root).get(5, TimeUnit.SECONDS)).hasSize(3);
        assertThat(root.isLoaded()).isTrue();
    }

    @Test
    void cancelWithoutLoadReportsFalse() {
        LazyNode root = root(open("[1]"));

        assertThat(coordinator.cancel(root)).isFalse();
    }

    @Test
    void failedLoadCanBeRetried() {
        doThrow(new IllegalStateException("boom")).doCallRealMethod().when(materializer)
            .materializeChildren(any(JsonDocument.class), any(LazyNode.class), anyInt(), anyInt(),
                any(CancellationSignal.class));
        LazyNode root = root(open("{\"a\":1}"));

        assertThatThrownBy(() -> coordinator.expand(root).join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(NodeLoadException.class);
        assertThat(root.getLoadState()).isEqualTo(LoadState.FAILED);
        assertThat(root.getFailure()).hasMessage("boom");

        assertThat(coordinator.expand(root).join()).extracting(LazyNode::getKey).containsExactly("a");
        assertThat(root.getLoadState()).isEqualTo(LoadState.LOADED);
        assertThat(root.getFailure()).isNull();
    }

    @Test
    void loadMoreAppendsPages() {
        config.setChildLimit(2);
        LazyNode root = root(open("[0,1,2,3,4]"));

        assertThat(coordinator.expand(root).join()).hasSize(2);
        assertThat(root.isPartial()).isTrue();

        assertThat(coordinator.loadMore(root).join()).hasSize(4);
        List<LazyNode> all = coordinator.loadMore(root).join();

        assertThat(all).extracting(LazyNode::getKey).containsExactly("[0]", "[1]", "[2]", "[3]", "[4]");
        assertThat(root.isPartial()).isFalse();
        assertThat(coordinator.loadMore(root).join()).hasSize(5);
        verifyMaterializations(3);
    }

    @Test
    void loadMoreOnUnloadedNodeExpandsIt() {
        config.setChildLimit(2);
        LazyNode root = root(open("[0,1,2]"));

        assertThat(coordinator.loadMore(root).join()).hasSize(2);
        assertThat(root.isPartial()).isTrue();
    }

    @Test
    void concurrentLoadsAreBounded() throws Exception {
        LazyNode root = root(open("[[1],[2],[3],[4],[5]]"));
        List<LazyNode> children = coordinator.expand(root).join();

        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        CountDownLatch threeStarted = new CountDownLatch(3);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            threeStarted.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
                return invocation.callRealMethod();
            } finally {
                running.decrementAndGet();
            }
        }).when(materializer).materializeChildren(any(JsonDocument.class), any(LazyNode.class), anyInt(), anyInt(),
            any(CancellationSignal.class));

        List<CompletableFuture<List<LazyNode>>> futures = new ArrayList<>();
        for (LazyNode child : children) {
            futures.add(coordinator.expand(child));
        }
        assertThat(threeStarted.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);

        assertThat(running.get()).isEqualTo(3);
        assertThat(coordinator.status().getActiveLoads()).isEqualTo(5);
        assertThat(coordinator.status().getMaxConcurrentLoads()).isEqualTo(3);

        release.countDown();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        assertThat(peak.get()).isEqualTo(3);
        assertThat(coordinator.status().getActiveLoads()).isZero();
        assertThat(coordinator.status().getAvailableSlots()).isEqualTo(3);
    }

    @Test
    void publishesChildrenLoaded() throws Exception {
        LazyNode root = root(open("{\"a\":1}"));
        BlockingQueue<TreeEvent> received = events.subscribeQueue();

        coordinator.expand(root).join();

        TreeEvent event = received.poll(5, TimeUnit.SECONDS);
        assertThat(event).isInstanceOf(TreeEvent.ChildrenLoaded.class);
        TreeEvent.ChildrenLoaded loaded = (TreeEvent.ChildrenLoaded) event;
        assertThat(loaded.getNode()).isSameAs(root);
        assertThat(loaded.getChildren()).hasSize(1);
        assertThat(loaded.isPartial()).isFalse();
    }

    @Test
    void expandAllReportsPerPath() {
        LazyNode root = root(open("{\"a\":{\"x\":1},\"b\":[1],\"c\":2}"));
        List<LazyNode> children = coordinator.expand(root).join();

        Map<NodePath, Boolean> outcome = coordinator.expandAll(children).join();

        assertThat(outcome).containsOnlyKeys(children.get(0).getPath(), children.get(1).getPath(), children.get(2).getPath());
        assertThat(outcome.values()).containsOnly(true);
        assertThat(children.get(0).isLoaded()).isTrue();
        assertThat(children.get(1).isLoaded()).isTrue();
    }

    @Test
    void preloadExpandsFirstFiveExpandableChildren() throws Exception {
        LazyNode root = root(open("{\"s\":1,\"a\":[1],\"b\":[1],\"c\":[1],\"d\":[1],\"e\":[1],\"f\":[1]}"));

        List<LazyNode> children = coordinator.preloadDirectChildren(root).get(5, TimeUnit.SECONDS);
        waitUntil(() -> children.subList(1, 6).stream().allMatch(LazyNode::isLoaded));

        assertThat(children).hasSize(7);
        assertThat(children.get(6).isLoaded()).isFalse();
        assertThat(children.get(0).isLoaded()).isFalse();
    }

    @Test
    void closeFailsQueuedLoadsAndResetsNodes() throws Exception {
        config.setMaxConcurrentLoads(1);
        LazyNode root = root(open("{\"a\":[1],\"b\":[2]}"));
        List<LazyNode> children = coordinator.expand(root).join();
        LazyNode a = children.get(0);
        LazyNode b = children.get(1);

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        blockMaterialization(started, release);
        try {
            CompletableFuture<List<LazyNode>> running = coordinator.expand(a);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            CompletableFuture<List<LazyNode>> queued = coordinator.expand(b);
            assertThat(b.getLoadState()).isEqualTo(LoadState.LOADING);

            coordinator.close();

            assertThatThrownBy(() -> queued.get(5, TimeUnit.SECONDS)).isInstanceOf(CancellationException.class);
            assertThatThrownBy(() -> running.get(5, TimeUnit.SECONDS)).isInstanceOf(CancellationException.class);
            assertThat(a.getLoadState()).isEqualTo(LoadState.IDLE);
            assertThat(b.getLoadState()).isEqualTo(LoadState.IDLE);
            assertThat(coordinator.isLoading(a.getPath())).isFalse();
            assertThat(coordinator.isLoading(b.getPath())).isFalse();
            assertThat(coordinator.status().getActiveLoads()).isZero();
        } finally {
            release.countDown();
        }
    }

    @Test
    void expandAfterCloseFailsImmediately() {
        LazyNode root = root(open("[1,2]"));
        coordinator.close();
        coordinator.close();

        CompletableFuture<List<LazyNode>> future = coordinator.expand(root);

        assertThat(future).isCompletedExceptionally();
        assertThat(root.getLoadState()).isEqualTo(LoadState.IDLE);
    }

    @Test
    void loadFinishingAfterCloseIsDiscarded() throws Exception {
        TreeMaterializer real = new TreeMaterializer(config);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        // ignores interrupts and the cancellation signal, so the page reaches the commit step
        doAnswer(invocation -> {
            started.countDown();
            boolean released = false;
            while (!released) {
                try {
                    release.await(10, TimeUnit.SECONDS);
                    released = true;
                } catch (InterruptedException e) {
                    // keep waiting for the test to release the load
                }
            }
            JsonDocument document = invocation.getArgument(0);
            LazyNode parent = invocation.getArgument(1);
            int offset = invocation.getArgument(2);
            int limit = invocation.getArgument(3);
            return real.materializeChildren(document, parent, offset, limit, CancellationSignal.none());
        }).when(materializer).materializeChildren(any(JsonDocument.class), any(LazyNode.class), anyInt(), anyInt(),
            any(CancellationSignal.class));
        LazyNode root = root(open("{\"a\":1,\"b\":2}"));
        BlockingQueue<TreeEvent> received = events.subscribeQueue();

        CompletableFuture<List<LazyNode>> future = coordinator.expand(root);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        coordinator.close();
        release.countDown();

        assertThatThrownBy(future::join).isInstanceOf(CancellationException.class);
        assertThat(received.poll(5, TimeUnit.SECONDS)).isInstanceOf(TreeEvent.NodeUpdated.class);
        assertThat(root.getLoadState()).isEqualTo(LoadState.IDLE);
        assertThat(root.getChildren()).isEmpty();
        assertThat(cache.get(NodePath.root().child("a"))).isNull();
        assertThat(cache.get(NodePath.root().child("b"))).isNull();
    }
}
