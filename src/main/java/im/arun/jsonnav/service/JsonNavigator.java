package im.arun.jsonnav.service;

import im.arun.jsonnav.analysis.StructureAnalyzer;
import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.document.DocumentParser;
import im.arun.jsonnav.document.JsonDocument;
import im.arun.jsonnav.event.TreeEvent;
import im.arun.jsonnav.event.TreeEventBus;
import im.arun.jsonnav.load.AsyncLoadCoordinator;
import im.arun.jsonnav.memory.HeapMemorySampler;
import im.arun.jsonnav.memory.MemoryPressureMonitor;
import im.arun.jsonnav.memory.MemorySampler;
import im.arun.jsonnav.memory.NodeCache;
import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.MemoryStatus;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.model.PathSegment;
import im.arun.jsonnav.model.SearchOptions;
import im.arun.jsonnav.model.SearchResult;
import im.arun.jsonnav.model.StructureInfo;
import im.arun.jsonnav.search.SearchEngine;
import im.arun.jsonnav.search.SearchIndex;
import im.arun.jsonnav.tree.NodeResolveException;
import im.arun.jsonnav.tree.TreeMaterializer;
import im.arun.jsonnav.tree.TreeSerializer;
import im.arun.jsonnav.util.CancellationSignal;
import im.arun.jsonnav.util.ExecutorProvider;
import im.arun.jsonnav.util.SessionJournal;
import im.arun.jsonnav.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for hosts: opens a document and exposes the lazy tree, analysis,
 * search and memory status of the current session. Opening another document
 * replaces the session.
 */
public class JsonNavigator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JsonNavigator.class);

    private final JsonNavConfig config;
    private final DocumentParser parser;
    private final StructureAnalyzer analyzer;
    private final TreeMaterializer materializer;
    private final TreeSerializer serializer;
    private final SearchEngine searchEngine;
    private final NodeCache cache;
    private final TreeEventBus events;
    private final MemoryPressureMonitor monitor;

    private volatile Session session;
    private volatile NodePath focus;
    private volatile CancellationSignal analysisSignal = CancellationSignal.none();
    private volatile boolean indexStale = true;

    public JsonNavigator(JsonNavConfig config) {
        this(config, new HeapMemorySampler());
    }

    public JsonNavigator(JsonNavConfig config, MemorySampler sampler) {
        this.config = config;
        this.parser = new DocumentParser(config);
        this.analyzer = new StructureAnalyzer();
        this.materializer = new TreeMaterializer(config);
        this.serializer = new TreeSerializer();
        this.searchEngine = new SearchEngine(config);
        this.cache = new NodeCache(config.getNodeCacheCapacity());
        this.events = new TreeEventBus();
        this.monitor = new MemoryPressureMonitor(config, sampler, cache, events,
            () -> session == null ? null : session.root, () -> focus);
        this.events.subscribe(this::onEvent);
    }

    public JsonDocument open(Path file) throws IOException {
        JsonDocument document = parser.parse(file);
        install(document);
        return document;
    }

    public JsonDocument open(byte[] content, String sourceName) {
        JsonDocument document = parser.parse(content, sourceName);
        install(document);
        return document;
    }

    private synchronized void install(JsonDocument document) {
        closeSession();

        LazyNode root = materializer.createRoot(document);
        AsyncLoadCoordinator coordinator = new AsyncLoadCoordinator(document, materializer, config, events, cache);
        SessionJournal journal = new SessionJournal(config.getJournalDirectory(), document.getSourceName());
        cache.put(root);
        session = new Session(document, root, coordinator, journal);

        journal.info("Opened document", Map.of(
            "source", document.getSourceName(),
            "bytes", document.getByteSize()));
        logger.info("Session opened for {}", document.getSourceName());

        if (config.isMemoryMonitorEnabled()) {
            monitor.start();
        }
    }

    private void closeSession() {
        Session previous = session;
        if (previous == null) {
            return;
        }
        analysisSignal.cancel();
        previous.coordinator.close();
        cache.clear();
        searchEngine.clearIndex();
        indexStale = true;
        focus = null;
        session = null;
        previous.journal.info("Closed document", Map.of("source", previous.document.getSourceName()));
    }

    public StructureInfo analyze() {
        Session current = requireSession();
        CancellationSignal signal = new CancellationSignal();
        analysisSignal = signal;
        StructureInfo info = analyzer.analyze(current.document, signal);
        current.journal.info("Structure analyzed", Map.of("summary", info.summary()));
        return info;
    }

    public CompletableFuture<StructureInfo> analyzeAsync() {
        Session current = requireSession();
        CancellationSignal signal = new CancellationSignal();
        analysisSignal = signal;
        return analyzer.analyzeAsync(current.document, signal).thenApply(info -> {
            current.journal.info("Structure analyzed", Map.of("summary", info.summary()));
            return info;
        });
    }

    public void cancelAnalysis() {
        analysisSignal.cancel();
    }

    public JsonDocument document() {
        return requireSession().document;
    }

    public LazyNode rootNode() {
        return requireSession().root;
    }

    /**
     * Marks the node expanded and loads its first page of children.
     */
    public CompletableFuture<List<LazyNode>> expand(LazyNode node) {
        Session current = requireSession();
        node.setExpanded(true);
        return current.coordinator.expand(node);
    }

    /**
     * Collapses the node. Its children stay loaded until the memory monitor evicts them.
     */
    public void collapse(LazyNode node) {
        node.setExpanded(false);
    }

    public CompletableFuture<List<LazyNode>> loadMore(LazyNode node) {
        return requireSession().coordinator.loadMore(node);
    }

    public boolean cancelLoad(LazyNode node) {
        return requireSession().coordinator.cancel(node);
    }

    /**
     * Focuses a node; it and its ancestors are kept loaded.
     */
    public void select(LazyNode node) {
        node.touch(System.currentTimeMillis());
        focus = node.getPath();
    }

    public NodePath focusedPath() {
        return focus;
    }

    /**
     * Expands every ancestor of {@code target}, paging through partially loaded
     * parents as needed, and completes with the target node.
     */
    public CompletableFuture<LazyNode> expandPath(NodePath target) {
        return descend(rootNode(), target, 0);
    }

    private CompletableFuture<LazyNode> descend(LazyNode node, NodePath target, int depth) {
        if (depth == target.depth()) {
            return CompletableFuture.completedFuture(node);
        }
        PathSegment segment = target.segments().get(depth);
        return expand(node)
            .thenCompose(children -> findChild(node, segment, target))
            .thenCompose(child -> descend(child, target, depth + 1));
    }

    private CompletableFuture<LazyNode> findChild(LazyNode node, PathSegment segment, NodePath target) {
        for (LazyNode child : node.getChildren()) {
            if (child.getPath().lastSegment().equals(segment)) {
                return CompletableFuture.completedFuture(child);
            }
        }
        if (node.isPartial()) {
            return loadMore(node).thenCompose(children -> findChild(node, segment, target));
        }
        return CompletableFuture.failedFuture(new NodeResolveException(target));
    }

    /**
     * Searches the materialized tree, rebuilding the index first if the tree changed.
     */
    public CompletableFuture<List<SearchResult>> search(String query, SearchOptions options) {
        Session current = requireSession();
        return CompletableFuture.supplyAsync(() -> {
            if (indexStale) {
                rebuild(current);
            }
            List<SearchResult> results = searchEngine.searchNow(query, options, new CancellationSignal());
            current.journal.info("Search", Map.of("query", query, "results", results.size()));
            return results;
        }, ExecutorProvider.getExecutor());
    }

    public SearchIndex rebuildSearchIndex() {
        return rebuild(requireSession());
    }

    private SearchIndex rebuild(Session current) {
        indexStale = false;
        return searchEngine.rebuildIndex(current.root);
    }

    public MemoryStatus memoryStatus() {
        return monitor.status();
    }

    public MemoryPressureMonitor memoryMonitor() {
        return monitor;
    }

    public TreeEventBus events() {
        return events;
    }

    public List<LazyNode> visibleNodes() {
        return TreeUtils.visibleNodes(rootNode());
    }

    /**
     * Looks a node up in the cache, then in the materialized tree.
     *
     * @return the node, or null if it is not materialized
     */
    public LazyNode findNode(NodePath path) {
        LazyNode cached = cache.get(path);
        if (cached != null) {
            return cached;
        }
        return TreeUtils.find(rootNode(), path);
    }

    public String toJson() {
        return serializer.toJson(rootNode());
    }

    public void save(Path output) throws IOException {
        Session current = requireSession();
        serializer.writeTo(current.root, output);
        current.journal.info("Saved tree", Map.of("output", output.toString()));
    }

    public SessionJournal journal() {
        return requireSession().journal;
    }

    @Override
    public synchronized void close() {
        monitor.stop();
        closeSession();
    }

    private void onEvent(TreeEvent event) {
        if (event instanceof TreeEvent.ChildrenLoaded) {
            indexStale = true;
        } else if (event instanceof TreeEvent.NodesEvicted) {
            indexStale = true;
            Session current = session;
            if (current != null) {
                current.journal.info("Evicted subtrees",
                    Map.of("count", ((TreeEvent.NodesEvicted) event).getPaths().size()));
            }
        } else if (event instanceof TreeEvent.MemoryLevelChanged) {
            TreeEvent.MemoryLevelChanged change = (TreeEvent.MemoryLevelChanged) event;
            Session current = session;
            if (change.isTransition() && current != null) {
                current.journal.warn("Memory level changed", Map.of(
                    "from", change.getPrevious().name(),
                    "to", change.getStatus().getLevel().name(),
                    "bytes", change.getStatus().getResidentBytes()));
            }
        }
    }

    private Session requireSession() {
        Session current = session;
        if (current == null) {
            throw new IllegalStateException("No document is open");
        }
        return current;
    }

    private static final class Session {
        final JsonDocument document;
        final LazyNode root;
        final AsyncLoadCoordinator coordinator;
        final SessionJournal journal;

        Session(JsonDocument document, LazyNode root, AsyncLoadCoordinator coordinator, SessionJournal journal) {
            this.document = document;
            this.root = root;
            this.coordinator = coordinator;
            this.journal = journal;
        }
    }
}
