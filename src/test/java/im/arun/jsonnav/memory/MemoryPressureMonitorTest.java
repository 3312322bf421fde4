package im.arun.jsonnav.memory;

import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.document.DocumentParser;
import im.arun.jsonnav.document.JsonDocument;
import im.arun.jsonnav.event.TreeEvent;
import im.arun.jsonnav.event.TreeEventBus;
import im.arun.jsonnav.model.ChildPage;
import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.MemoryLevel;
import im.arun.jsonnav.model.MemoryStatus;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.tree.TreeMaterializer;
import im.arun.jsonnav.util.CancellationSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemoryPressureMonitorTest {

    private static final long WARNING = 1_000;
    private static final long CRITICAL = 2_000;

    @Mock
    private MemorySampler sampler;

    private JsonNavConfig config;
    private NodeCache cache;
    private TreeEventBus events;
    private LazyNode root;
    private MemoryPressureMonitor monitor;

    @BeforeEach
    void setUp() {
        config = new JsonNavConfig();
        config.setWarningThresholdBytes(WARNING);
        config.setCriticalThresholdBytes(CRITICAL);
        config.setSamplingIntervalMillis(20);

        JsonDocument document = new DocumentParser(config)
            .parse("{\"a\":[1,2],\"b\":{\"c\":3}}".getBytes(StandardCharsets.UTF_8), "monitor.json");
        TreeMaterializer materializer = new TreeMaterializer(config, () -> 0L);
        cache = new NodeCache(100);
        events = new TreeEventBus();
        root = materializer.createRoot(document);
        load(materializer, document, root);
        for (LazyNode child : root.getChildren()) {
            load(materializer, document, child);
        }
        root.setExpanded(true);

        monitor = new MemoryPressureMonitor(config, sampler, cache, events, () -> root, () -> null);
    }

    @AfterEach
    void tearDown() {
        monitor.stop();
    }

    private void load(TreeMaterializer materializer, JsonDocument document, LazyNode node) {
        node.beginLoading();
        ChildPage page = materializer.materializeChildren(document, node, 0, 100, CancellationSignal.none());
        node.completeLoading(page.getChildren(), page.isPartial());
        cache.putAll(page.getChildren());
    }

    @Test
    void normalSampleLeavesTreeAlone() {
        when(sampler.usedBytes()).thenReturn(500L);

        MemoryStatus status = monitor.sampleOnce(1_000);

        assertThat(status.getLevel()).isEqualTo(MemoryLevel.NORMAL);
        assertThat(status.getResidentBytes()).isEqualTo(500L);
        assertThat(status.getEvictionCount()).isZero();
        assertThat(root.getChildren()).allMatch(LazyNode::isLoaded);
    }

    @Test
    void regularCleanupEvictsEveryCollapsedNode() {
        when(sampler.usedBytes()).thenReturn(1_500L);

        MemoryStatus status = monitor.sampleOnce(1_000);

        assertThat(status.getLevel()).isEqualTo(MemoryLevel.WARNING);
        assertThat(status.getEvictionCount()).isEqualTo(2);
        assertThat(root.isLoaded()).isTrue();
        assertThat(root.getChildren()).noneMatch(LazyNode::isLoaded);
    }

    @Test
    void regularCleanupHonoursIdleGate() {
        config.setRegularIdleMillis(30_000);
        monitor = new MemoryPressureMonitor(config, sampler, cache, events, () -> root, () -> null);
        when(sampler.usedBytes()).thenReturn(1_500L);

        MemoryStatus early = monitor.sampleOnce(1_000);
        MemoryStatus late = monitor.sampleOnce(30_001);

        assertThat(early.getLevel()).isEqualTo(MemoryLevel.WARNING);
        assertThat(early.getEvictionCount()).isZero();
        assertThat(late.getEvictionCount()).isEqualTo(2);
        assertThat(root.getChildren()).noneMatch(LazyNode::isLoaded);
    }

    @Test
    void emergencyCleanupFlushesCacheAndRequestsReclaim() throws Exception {
        when(sampler.usedBytes()).thenReturn(5_000L);
        AtomicInteger reclaims = new AtomicInteger();
        monitor.setReclaimAction(reclaims::incrementAndGet);
        BlockingQueue<TreeEvent> received = events.subscribeQueue();

        MemoryStatus status = monitor.sampleOnce(1_000);

        assertThat(status.getLevel()).isEqualTo(MemoryLevel.CRITICAL);
        assertThat(status.getEvictionCount()).isEqualTo(2);
        assertThat(status.getCacheSize()).isZero();
        assertThat(reclaims.get()).isEqualTo(1);

        TreeEvent levelChange = received.poll(1, TimeUnit.SECONDS);
        assertThat(levelChange).isInstanceOf(TreeEvent.MemoryLevelChanged.class);
        assertThat(((TreeEvent.MemoryLevelChanged) levelChange).isTransition()).isTrue();
        TreeEvent evicted = received.poll(1, TimeUnit.SECONDS);
        assertThat(evicted).isInstanceOf(TreeEvent.NodesEvicted.class);
        assertThat(((TreeEvent.NodesEvicted) evicted).getPaths())
            .containsExactly(NodePath.parse("$.a"), NodePath.parse("$.b"));
    }

    @Test
    void failingSamplerIsLoggedAndSkipped() {
        when(sampler.usedBytes()).thenThrow(new IllegalStateException("no bean")).thenReturn(100L);

        MemoryStatus failed = monitor.sampleOnce(1_000);
        MemoryStatus next = monitor.sampleOnce(3_000);

        assertThat(failed.getLevel()).isEqualTo(MemoryLevel.NORMAL);
        assertThat(next.getResidentBytes()).isEqualTo(100L);
        assertThat(next.getTimestamp()).isEqualTo(3_000);
    }

    @Test
    void escalatesToAggressiveAfterRepeatedWarnings() {
        config.setRegularIdleMillis(60_000);
        monitor = new MemoryPressureMonitor(config, sampler, cache, events, () -> root, () -> null);
        when(sampler.usedBytes()).thenReturn(1_500L);

        assertThat(monitor.sampleOnce(1_000).getEvictionCount()).isZero();
        monitor.sampleOnce(2_000);
        MemoryStatus third = monitor.sampleOnce(3_000);

        assertThat(monitor.state().getConsecutiveWarnings()).isEqualTo(3);
        assertThat(monitor.state().getLastAggressiveCleanupMillis()).isEqualTo(3_000);
        assertThat(third.getEvictionCount()).isEqualTo(2);
    }

    @Test
    void scheduledSamplingRuns() throws Exception {
        when(sampler.usedBytes()).thenReturn(100L);

        monitor.start();
        assertThat(monitor.isRunning()).isTrue();
        long deadline = System.currentTimeMillis() + 5_000;
        while (monitor.status().getTimestamp() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        monitor.stop();

        assertThat(monitor.status().getTimestamp()).isPositive();
        assertThat(monitor.isRunning()).isFalse();
    }
}
