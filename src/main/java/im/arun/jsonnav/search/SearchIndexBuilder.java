package im.arun.jsonnav.search;

import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.SearchMatchType;
import im.arun.jsonnav.util.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link SearchIndex} from the materialized part of a tree. Unloaded
 * subtrees are not visited, so they are not searchable until expanded.
 */
public class SearchIndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SearchIndexBuilder.class);
    private static final int CANCEL_CHECK_INTERVAL = 1024;

    private final int ngramSize;
    private final int ngramMinValueLength;

    public SearchIndexBuilder(int ngramSize, int ngramMinValueLength) {
        this.ngramSize = ngramSize;
        this.ngramMinValueLength = ngramMinValueLength;
    }

    public SearchIndex build(LazyNode root, CancellationSignal signal) {
        if (root == null) {
            return SearchIndex.EMPTY;
        }

        long start = System.currentTimeMillis();
        Map<String, List<IndexEntry>> buckets = new HashMap<>();
        List<IndexEntry> entries = new ArrayList<>();

        Deque<LazyNode> stack = new ArrayDeque<>();
        stack.push(root);
        int visited = 0;
        while (!stack.isEmpty()) {
            if (++visited % CANCEL_CHECK_INTERVAL == 0) {
                signal.throwIfCancelled();
            }
            LazyNode node = stack.pop();
            index(node, buckets, entries);

            List<LazyNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        signal.throwIfCancelled();

        SearchIndex index = new SearchIndex(buckets, entries);
        logger.info("Search index built: {} nodes, {} entries, {} buckets in {} ms",
            visited, index.entryCount(), index.bucketCount(), System.currentTimeMillis() - start);
        return index;
    }

    private void index(LazyNode node, Map<String, List<IndexEntry>> buckets, List<IndexEntry> entries) {
        // array positions are not searchable keys
        if (!node.getPath().isRoot() && !node.getPath().lastSegment().isIndex()) {
            add(new IndexEntry(node.getPath(), SearchMatchType.KEY, node.getKey()), buckets, entries);
        }

        if (!node.getKind().isContainer()) {
            IndexEntry value = new IndexEntry(node.getPath(), SearchMatchType.VALUE, node.getDisplayValue());
            add(value, buckets, entries);

            String lower = value.getContent().toLowerCase(Locale.ROOT);
            if (lower.length() > ngramMinValueLength) {
                Set<String> grams = new HashSet<>();
                for (int i = 0; i + ngramSize <= lower.length(); i++) {
                    grams.add(lower.substring(i, i + ngramSize));
                }
                for (String gram : grams) {
                    buckets.computeIfAbsent(gram, k -> new ArrayList<>()).add(value);
                }
            }
        }

        add(new IndexEntry(node.getPath(), SearchMatchType.PATH, node.getPath().toJsonPath()), buckets, entries);
    }

    private static void add(IndexEntry entry, Map<String, List<IndexEntry>> buckets, List<IndexEntry> entries) {
        entries.add(entry);
        buckets.computeIfAbsent(entry.getContent().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(entry);
    }
}
