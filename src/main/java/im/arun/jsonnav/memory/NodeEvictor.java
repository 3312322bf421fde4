package im.arun.jsonnav.memory;

import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Drops the children of collapsed, loaded nodes to release memory.
 *
 * <p>Never touched: expanded nodes, nodes that are loading, nodes on the path from
 * the focused node to the root, and any node whose materialized subtree still holds
 * one of those. For the latter the sweep descends and evicts beneath instead.
 */
public class NodeEvictor {
    private static final Logger logger = LoggerFactory.getLogger(NodeEvictor.class);

    private final long regularIdleMillis;
    private final NodeCache cache;

    public NodeEvictor(long regularIdleMillis, NodeCache cache) {
        this.regularIdleMillis = regularIdleMillis;
        this.cache = cache;
    }

    /**
     * @param protectedPath focused node's path, or null
     * @return paths of the nodes whose children were dropped, top-most first
     */
    public List<NodePath> sweep(LazyNode root, EvictionMode mode, long now, NodePath protectedPath) {
        if (root == null) {
            return Collections.emptyList();
        }

        Set<LazyNode> pinnedBelow = Collections.newSetFromMap(new IdentityHashMap<>());
        markPinned(root, protectedPath, pinnedBelow);

        List<NodePath> evicted = new ArrayList<>();
        int[] dropped = {0};
        evict(root, mode, now, protectedPath, pinnedBelow, evicted, dropped);

        if (!evicted.isEmpty()) {
            logger.info("{} sweep evicted children of {} nodes ({} nodes released)", mode, evicted.size(), dropped[0]);
        }
        return evicted;
    }

    /**
     * Post-order pass recording every node that has a pinned strict descendant.
     *
     * @return true if the node itself or something beneath it is pinned
     */
    private boolean markPinned(LazyNode node, NodePath protectedPath, Set<LazyNode> pinnedBelow) {
        boolean below = false;
        for (LazyNode child : node.getChildren()) {
            if (markPinned(child, protectedPath, pinnedBelow)) {
                below = true;
            }
        }
        if (below) {
            pinnedBelow.add(node);
        }
        return below || isPinned(node, protectedPath);
    }

    private void evict(LazyNode node, EvictionMode mode, long now, NodePath protectedPath,
                       Set<LazyNode> pinnedBelow, List<NodePath> evicted, int[] dropped) {
        if (isCandidate(node, mode, now, protectedPath) && !pinnedBelow.contains(node)) {
            List<LazyNode> children = node.evictChildren();
            if (!children.isEmpty()) {
                evicted.add(node.getPath());
                for (LazyNode child : children) {
                    TreeUtils.forEachMaterialized(child, released -> {
                        cache.remove(released.getPath());
                        dropped[0]++;
                    });
                }
            }
            return;
        }
        for (LazyNode child : node.getChildren()) {
            evict(child, mode, now, protectedPath, pinnedBelow, evicted, dropped);
        }
    }

    private boolean isCandidate(LazyNode node, EvictionMode mode, long now, NodePath protectedPath) {
        if (!node.isLoaded() || isPinned(node, protectedPath)) {
            return false;
        }
        return mode != EvictionMode.REGULAR || now - node.getLastAccess() >= regularIdleMillis;
    }

    private static boolean isPinned(LazyNode node, NodePath protectedPath) {
        return node.isExpanded()
            || node.isLoading()
            || (protectedPath != null && node.getPath().isAncestorOf(protectedPath));
    }
}
