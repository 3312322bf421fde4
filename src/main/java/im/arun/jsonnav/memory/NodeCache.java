package im.arun.jsonnav.memory;

import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.NodePath;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded path index over materialized nodes. Best effort: the tree stays
 * authoritative, and when full the oldest insertion is dropped.
 */
public class NodeCache {
    private final int capacity;
    private final Map<NodePath, LazyNode> entries;
    private long hits;
    private long misses;

    public NodeCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<NodePath, LazyNode> eldest) {
                return size() > NodeCache.this.capacity;
            }
        };
    }

    public synchronized void put(LazyNode node) {
        entries.put(node.getPath(), node);
    }

    public synchronized void putAll(Collection<LazyNode> nodes) {
        for (LazyNode node : nodes) {
            entries.put(node.getPath(), node);
        }
    }

    public synchronized LazyNode get(NodePath path) {
        LazyNode node = entries.get(path);
        if (node == null) {
            misses++;
        } else {
            hits++;
        }
        return node;
    }

    public synchronized LazyNode remove(NodePath path) {
        return entries.remove(path);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
