package im.arun.jsonnav.search;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of the searchable text of the materialized tree.
 *
 * <p>Buckets are keyed by lowercased text (whole keys, values and paths, plus
 * n-grams of long values). Every entry also appears once in {@link #entries()}.
 */
public class SearchIndex {
    public static final SearchIndex EMPTY = new SearchIndex(Collections.emptyMap(), Collections.emptyList());

    // rough per-entry overhead: entry object, list slot, path reference
    private static final int ENTRY_OVERHEAD_BYTES = 48;

    private final Map<String, List<IndexEntry>> buckets;
    private final List<IndexEntry> entries;

    SearchIndex(Map<String, List<IndexEntry>> buckets, List<IndexEntry> entries) {
        this.buckets = Collections.unmodifiableMap(buckets);
        this.entries = Collections.unmodifiableList(entries);
    }

    public Map<String, List<IndexEntry>> buckets() {
        return buckets;
    }

    public List<IndexEntry> entries() {
        return entries;
    }

    public int bucketCount() {
        return buckets.size();
    }

    public int entryCount() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public long estimatedBytes() {
        long bytes = 0;
        for (Map.Entry<String, List<IndexEntry>> bucket : buckets.entrySet()) {
            bytes += 2L * bucket.getKey().length() + 8L * bucket.getValue().size();
        }
        for (IndexEntry entry : entries) {
            bytes += ENTRY_OVERHEAD_BYTES + 2L * entry.getContent().length();
        }
        return bytes;
    }
}
