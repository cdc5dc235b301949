package com.contextbus.observability;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationEventBusTest {

    @Test
    void sessionSubscribersOnlySeeTheirSession() {
        OrchestrationEventBus bus = new OrchestrationEventBus(Runnable::run);
        List<OrchestrationEvent> mine = new CopyOnWriteArrayList<>();
        List<OrchestrationEvent> all = new CopyOnWriteArrayList<>();
        bus.subscribe("ses-1", mine::add);
        bus.subscribeAll(all::add);

        bus.publish(OrchestrationEvent.session(OrchestrationEvent.SESSION_STARTED, "ses-1", Map.of()));
        bus.publish(OrchestrationEvent.session(OrchestrationEvent.SESSION_STARTED, "ses-2", Map.of()));

        assertEquals(1, mine.size());
        assertEquals(2, all.size());
    }

    @Test
    void failingSubscriber_doesNotBlockOthers() {
        OrchestrationEventBus bus = new OrchestrationEventBus(Runnable::run);
        List<OrchestrationEvent> received = new CopyOnWriteArrayList<>();
        bus.subscribeAll(e -> { throw new IllegalStateException("broken consumer"); });
        bus.subscribeAll(received::add);

        assertDoesNotThrow(() -> bus.publish(OrchestrationEvent.phase(OrchestrationEvent.PHASE_STARTED, "ses-1",
            "investigation", Map.of())));
        assertEquals(1, received.size());
    }

    @Test
    void unsubscribedConsumer_receivesNothingMore() {
        OrchestrationEventBus bus = new OrchestrationEventBus(Runnable::run);
        List<OrchestrationEvent> received = new CopyOnWriteArrayList<>();
        OrchestrationEventBus.Subscription subscription = bus.subscribe("ses-1", received::add);

        bus.publish(OrchestrationEvent.session(OrchestrationEvent.SESSION_STARTED, "ses-1", Map.of()));
        subscription.unsubscribe();
        bus.publish(OrchestrationEvent.session(OrchestrationEvent.SESSION_COMPLETED, "ses-1", Map.of()));

        assertEquals(1, received.size());
    }

    @Test
    void defaultBus_deliversOffThePublishingThread() throws Exception {
        OrchestrationEventBus bus = new OrchestrationEventBus();
        CountDownLatch delivered = new CountDownLatch(1);
        Thread publisher = Thread.currentThread();
        List<Thread> deliveryThreads = new CopyOnWriteArrayList<>();
        bus.subscribeAll(e -> {
            deliveryThreads.add(Thread.currentThread());
            delivered.countDown();
        });
        try {
            bus.publish(OrchestrationEvent.session(OrchestrationEvent.SESSION_STARTED, "ses-1", Map.of()));
            assertTrue(delivered.await(2, TimeUnit.SECONDS));
            assertNotSame(publisher, deliveryThreads.get(0));
        } finally {
            bus.shutdown();
        }
    }
}
