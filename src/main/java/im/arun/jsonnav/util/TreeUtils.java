package im.arun.jsonnav.util;

import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.model.PathSegment;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Utility methods over the materialized part of a lazy tree. None of these
 * trigger loading; unloaded subtrees are simply not visited.
 */
public class TreeUtils {

    /**
     * Flattens the nodes a tree widget shows, in display order: the root, then the
     * children of every expanded node, depth first.
     */
    public static List<LazyNode> visibleNodes(LazyNode root) {
        List<LazyNode> result = new ArrayList<>();
        if (root == null) {
            return result;
        }

        Deque<LazyNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            LazyNode node = stack.pop();
            result.add(node);
            if (node.isExpanded()) {
                List<LazyNode> children = node.getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            }
        }
        return result;
    }

    /**
     * Visits every materialized node, pre-order, regardless of expansion.
     */
    public static void forEachMaterialized(LazyNode root, Consumer<LazyNode> visitor) {
        if (root == null) {
            return;
        }

        Deque<LazyNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            LazyNode node = stack.pop();
            visitor.accept(node);
            List<LazyNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }

    public static List<LazyNode> materializedNodes(LazyNode root) {
        List<LazyNode> result = new ArrayList<>();
        forEachMaterialized(root, result::add);
        return result;
    }

    public static int countMaterialized(LazyNode root) {
        int[] count = {0};
        forEachMaterialized(root, node -> count[0]++);
        return count[0];
    }

    /**
     * Finds a node by path, walking only materialized children.
     *
     * @return the node, or null if some node on the way is not loaded
     */
    public static LazyNode find(LazyNode root, NodePath path) {
        if (root == null || path == null) {
            return null;
        }

        LazyNode current = root;
        for (PathSegment segment : path.segments()) {
            LazyNode next = null;
            List<LazyNode> children = current.getChildren();
            if (segment.isIndex() && segment.getIndex() < children.size()) {
                LazyNode candidate = children.get(segment.getIndex());
                if (candidate.getPath().lastSegment().equals(segment)) {
                    current = candidate;
                    continue;
                }
            }
            for (LazyNode child : children) {
                PathSegment last = child.getPath().lastSegment();
                if (last.equals(segment)) {
                    next = child;
                    break;
                }
            }
            if (next == null) {
                return null;
            }
            current = next;
        }
        return current;
    }
}
