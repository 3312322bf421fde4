package im.arun.jsonnav.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Synchronous fan-out of {@link TreeEvent}s. Listeners run on the publishing
 * thread (a loader or the monitor); a failing listener does not affect the others.
 */
public class TreeEventBus {
    private static final Logger logger = LoggerFactory.getLogger(TreeEventBus.class);

    private final List<Consumer<? super TreeEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * @return a handle that unsubscribes the listener when closed
     */
    public AutoCloseable subscribe(Consumer<? super TreeEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Subscribes a queue that receives every event published from now on.
     */
    public BlockingQueue<TreeEvent> subscribeQueue() {
        BlockingQueue<TreeEvent> queue = new LinkedBlockingQueue<>();
        listeners.add(queue::offer);
        return queue;
    }

    public void publish(TreeEvent event) {
        logger.debug("Publishing {}", event);
        for (Consumer<? super TreeEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                logger.error("Event listener failed on {}", event, e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
