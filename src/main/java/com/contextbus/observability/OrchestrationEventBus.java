package com.contextbus.observability;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * In-process pub/sub for orchestration events, with per-session and global
 * subscriptions.
 *
 * Delivery happens on a dedicated thread so a slow or failing subscriber
 * never holds up the scheduler; events of one bus are delivered in publish
 * order. Nothing a subscriber does flows back into execution.
 */
@Service
public class OrchestrationEventBus {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationEventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<OrchestrationEvent>>> sessionSubscribers =
        new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<OrchestrationEvent>> globalSubscribers = new CopyOnWriteArrayList<>();
    private final Executor delivery;
    private final ExecutorService ownedDelivery;

    @Autowired
    public OrchestrationEventBus() {
        this.ownedDelivery = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "orchestration-events");
            t.setDaemon(true);
            return t;
        });
        this.delivery = ownedDelivery;
    }

    /** Bus delivering on the given executor; {@code Runnable::run} delivers inline. */
    public OrchestrationEventBus(Executor delivery) {
        this.delivery = delivery;
        this.ownedDelivery = null;
    }

    public void publish(OrchestrationEvent event) {
        try {
            delivery.execute(() -> deliver(event));
        } catch (RejectedExecutionException ex) {
            log.debug("Dropped event {} for session {}: bus is shut down", event.eventType(), event.sessionId());
        }
    }

    public Subscription subscribe(String sessionId, Consumer<OrchestrationEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<OrchestrationEvent>> subs = sessionSubscribers.get(sessionId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<OrchestrationEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @PreDestroy
    void shutdown() {
        if (ownedDelivery != null) {
            ownedDelivery.shutdown();
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(OrchestrationEvent event) {
        List<Consumer<OrchestrationEvent>> subs = sessionSubscribers.get(event.sessionId());
        if (subs != null) {
            subs.forEach(s -> deliverSafely(s, event));
        }
        globalSubscribers.forEach(s -> deliverSafely(s, event));
    }

    private void deliverSafely(Consumer<OrchestrationEvent> subscriber, OrchestrationEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception ex) {
            log.warn("Subscriber failed on event {} for session {}: {}",
                event.eventType(), event.sessionId(), ex.getMessage());
        }
    }
}
