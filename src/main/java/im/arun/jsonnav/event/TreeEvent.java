package im.arun.jsonnav.event;

import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.MemoryLevel;
import im.arun.jsonnav.model.MemoryStatus;
import im.arun.jsonnav.model.NodePath;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Notifications published to hosts when the tree or memory state changes.
 */
@Getter
public abstract class TreeEvent {
    private final long timestamp;

    protected TreeEvent(long timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * A node's load state changed without new children (failure, cancellation).
     */
    @Getter
    public static final class NodeUpdated extends TreeEvent {
        private final LazyNode node;

        public NodeUpdated(LazyNode node, long timestamp) {
            super(timestamp);
            this.node = node;
        }

        @Override
        public String toString() {
            return "NodeUpdated[" + node.getPath() + " " + node.getLoadState() + "]";
        }
    }

    @Getter
    public static final class ChildrenLoaded extends TreeEvent {
        private final LazyNode node;
        private final List<LazyNode> children;
        private final boolean partial;

        public ChildrenLoaded(LazyNode node, List<LazyNode> children, boolean partial, long timestamp) {
            super(timestamp);
            this.node = node;
            this.children = Collections.unmodifiableList(children);
            this.partial = partial;
        }

        @Override
        public String toString() {
            return "ChildrenLoaded[" + node.getPath() + " +" + children.size() + (partial ? " partial" : "") + "]";
        }
    }

    @Getter
    public static final class NodesEvicted extends TreeEvent {
        private final List<NodePath> paths;

        public NodesEvicted(List<NodePath> paths, long timestamp) {
            super(timestamp);
            this.paths = Collections.unmodifiableList(paths);
        }

        @Override
        public String toString() {
            return "NodesEvicted[" + paths.size() + "]";
        }
    }

    @Getter
    public static final class MemoryLevelChanged extends TreeEvent {
        private final MemoryLevel previous;
        private final MemoryStatus status;

        public MemoryLevelChanged(MemoryLevel previous, MemoryStatus status) {
            super(status.getTimestamp());
            this.previous = previous;
            this.status = status;
        }

        public boolean isTransition() {
            return previous != status.getLevel();
        }

        @Override
        public String toString() {
            return "MemoryLevelChanged[" + previous + " -> " + status.getLevel() + "]";
        }
    }
}
