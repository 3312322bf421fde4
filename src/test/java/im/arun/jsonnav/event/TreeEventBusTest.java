package im.arun.jsonnav.event;

import im.arun.jsonnav.model.NodePath;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

import static org.assertj.core.api.Assertions.assertThat;

class TreeEventBusTest {

    @Test
    void deliversToEverySubscriber() {
        TreeEventBus bus = new TreeEventBus();
        List<TreeEvent> first = new ArrayList<>();
        List<TreeEvent> second = new ArrayList<>();
        bus.subscribe(first::add);
        bus.subscribe(second::add);

        TreeEvent event = new TreeEvent.NodesEvicted(List.of(NodePath.parse("$.a")), 5);
        bus.publish(event);

        assertThat(first).containsExactly(event);
        assertThat(second).containsExactly(event);
        assertThat(event.getTimestamp()).isEqualTo(5);
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        TreeEventBus bus = new TreeEventBus();
        List<TreeEvent> received = new ArrayList<>();
        bus.subscribe(event -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe(received::add);

        bus.publish(new TreeEvent.NodesEvicted(List.of(), 1));

        assertThat(received).hasSize(1);
    }

    @Test
    void closingSubscriptionStopsDelivery() throws Exception {
        TreeEventBus bus = new TreeEventBus();
        List<TreeEvent> received = new ArrayList<>();
        AutoCloseable subscription = bus.subscribe(received::add);

        subscription.close();
        bus.publish(new TreeEvent.NodesEvicted(List.of(), 1));

        assertThat(received).isEmpty();
        assertThat(bus.listenerCount()).isZero();
    }

    @Test
    void queueSubscriptionCollectsEvents() {
        TreeEventBus bus = new TreeEventBus();
        BlockingQueue<TreeEvent> queue = bus.subscribeQueue();

        bus.publish(new TreeEvent.NodesEvicted(List.of(), 1));
        bus.publish(new TreeEvent.NodesEvicted(List.of(), 2));

        assertThat(queue).hasSize(2);
    }
}
