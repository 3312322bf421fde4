package im.arun.jsonnav.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A navigable tree element for one JSON value at a specific path.
 *
 * <p>Children are materialized on demand and may be dropped again under memory
 * pressure. Every state transition is made under this node's monitor, which is
 * the only mutual-exclusion point between loading and eviction.
 */
public class LazyNode {

    @Getter
    private final NodePath path;
    @Getter
    private final String key;
    @Getter
    private final NodeKind kind;
    @Getter
    private final String displayValue;
    @Getter
    private final int childCount;

    // Leaf value shared with the decoded document; null for containers
    private final JsonNode leafValue;
    private final WeakReference<LazyNode> parent;

    private volatile boolean expanded;
    private volatile long lastAccess;

    private LoadState loadState = LoadState.IDLE;
    private List<LazyNode> children = Collections.emptyList();
    private boolean partial;
    private Throwable failure;

    public LazyNode(LazyNode parent, NodePath path, String key, NodeKind kind,
                    String displayValue, int childCount, JsonNode leafValue, long createdAt) {
        this.parent = parent == null ? null : new WeakReference<>(parent);
        this.path = path;
        this.key = key;
        this.kind = kind;
        this.displayValue = displayValue;
        this.childCount = childCount;
        this.leafValue = kind.isContainer() ? null : leafValue;
        this.lastAccess = createdAt;
    }

    public LazyNode getParent() {
        return parent == null ? null : parent.get();
    }

    public JsonNode getLeafValue() {
        return leafValue;
    }

    public int getDepth() {
        return path.depth();
    }

    public boolean isExpandable() {
        return kind.isContainer() && childCount > 0;
    }

    public boolean isExpanded() {
        return expanded;
    }

    public void setExpanded(boolean expanded) {
        this.expanded = expanded;
    }

    public long getLastAccess() {
        return lastAccess;
    }

    public void touch(long now) {
        this.lastAccess = now;
    }

    public synchronized LoadState getLoadState() {
        return loadState;
    }

    public synchronized boolean isLoaded() {
        return loadState == LoadState.LOADED;
    }

    public synchronized boolean isLoading() {
        return loadState == LoadState.LOADING;
    }

    /**
     * True when the last materialization stopped at the child limit.
     */
    public synchronized boolean isPartial() {
        return partial;
    }

    public synchronized Throwable getFailure() {
        return failure;
    }

    /**
     * Snapshot of the materialized children, empty unless loaded.
     */
    public synchronized List<LazyNode> getChildren() {
        if (children.isEmpty()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(children));
    }

    public synchronized int getLoadedChildCount() {
        return children.size();
    }

    /**
     * Moves an idle or failed node to {@link LoadState#LOADING}.
     *
     * @return false if the node is already loading or loaded
     */
    public synchronized boolean beginLoading() {
        if (loadState == LoadState.IDLE || loadState == LoadState.FAILED) {
            loadState = LoadState.LOADING;
            failure = null;
            return true;
        }
        return false;
    }

    /**
     * Moves a loaded, partial node back to {@link LoadState#LOADING} while the next
     * page is fetched. Already materialized children stay visible.
     */
    public synchronized boolean beginLoadingMore() {
        if (loadState == LoadState.LOADED && partial) {
            loadState = LoadState.LOADING;
            return true;
        }
        return false;
    }

    public synchronized void completeLoading(List<LazyNode> loaded, boolean partial) {
        if (loadState != LoadState.LOADING) {
            throw new IllegalStateException("Node " + path + " is not loading but " + loadState);
        }
        this.children = new ArrayList<>(loaded);
        this.partial = partial;
        this.loadState = LoadState.LOADED;
    }

    public synchronized void completeLoadingMore(List<LazyNode> more, boolean partial) {
        if (loadState != LoadState.LOADING) {
            throw new IllegalStateException("Node " + path + " is not loading but " + loadState);
        }
        List<LazyNode> merged = new ArrayList<>(children.size() + more.size());
        merged.addAll(children);
        merged.addAll(more);
        this.children = merged;
        this.partial = partial;
        this.loadState = LoadState.LOADED;
    }

    public synchronized void failLoading(Throwable cause) {
        this.failure = cause;
        if (children.isEmpty()) {
            this.loadState = LoadState.FAILED;
        } else {
            // a failed page fetch keeps the pages already loaded
            this.loadState = LoadState.LOADED;
        }
    }

    public synchronized void cancelLoading() {
        this.loadState = children.isEmpty() ? LoadState.IDLE : LoadState.LOADED;
    }

    /**
     * Drops the materialized children of a loaded node and returns it to {@link LoadState#IDLE}.
     * Does nothing unless the node is {@link LoadState#LOADED}.
     *
     * @return the dropped children, empty if nothing was evicted
     */
    public synchronized List<LazyNode> evictChildren() {
        if (loadState != LoadState.LOADED) {
            return Collections.emptyList();
        }
        List<LazyNode> dropped = children;
        this.children = Collections.emptyList();
        this.partial = false;
        this.loadState = LoadState.IDLE;
        return dropped;
    }

    @Override
    public String toString() {
        return key + ": " + displayValue;
    }
}
