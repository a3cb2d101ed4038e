package com.aura.core.events;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Live-state channel for object events.
 * <p>
 * {@link #publish} is fire-and-forget: the event is queued and delivered on the
 * bus's own delivery thread, in publication order, so a dispatch never waits on
 * a subscriber. Delivery is best-effort. A failing subscriber is logged and the
 * remaining subscribers still receive the event; events published after
 * {@link #close()} are dropped.
 */
@Service
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AuraEvent>>> objectSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<AuraEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    private final Executor deliveryExecutor;
    private final ExecutorService ownedExecutor;
    private volatile boolean closed;

    public EventBus() {
        this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "aura-events");
            t.setDaemon(true);
            return t;
        });
        this.deliveryExecutor = ownedExecutor;
    }

    /**
     * Delivers on the given executor; the caller keeps ownership of it.
     */
    public EventBus(Executor deliveryExecutor) {
        this.deliveryExecutor = deliveryExecutor;
        this.ownedExecutor = null;
    }

    /**
     * Queues an event for every subscriber of its object and every global subscriber.
     *
     * @return true when the event was accepted for delivery
     */
    public boolean publish(AuraEvent event) {
        if (closed) {
            log.debug("Dropping {} for '{}': event bus closed", event.eventType(), event.objectId());
            return false;
        }
        try {
            deliveryExecutor.execute(() -> deliver(event));
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Dropping {} for '{}': {}", event.eventType(), event.objectId(), e.getMessage());
            return false;
        }
    }

    private void deliver(AuraEvent event) {
        log.debug("Delivering {} for object {}", event.eventType(), event.objectId());
        List<Consumer<AuraEvent>> objectSubs = objectSubscribers.get(event.objectId());
        if (objectSubs != null) {
            objectSubs.forEach(subscriber -> deliverSafely(subscriber, event));
        }
        globalSubscribers.forEach(subscriber -> deliverSafely(subscriber, event));
    }

    public Subscription subscribe(String objectId, Consumer<AuraEvent> consumer) {
        objectSubscribers.computeIfAbsent(objectId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to object {}", objectId);
        return () -> objectSubscribers.computeIfPresent(objectId, (k, subs) -> {
            subs.remove(consumer);
            return subs.isEmpty() ? null : subs;
        });
    }

    public Subscription subscribeAll(Consumer<AuraEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops accepting events and drains the queue for up to five seconds.
     */
    @PreDestroy
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (ownedExecutor == null) {
            return;
        }
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Event delivery did not drain in time; {} pending deliveries discarded",
                        ownedExecutor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AuraEvent> subscriber, AuraEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber failed on {} for '{}': {}", event.eventType(), event.objectId(), e.getMessage(), e);
        }
    }
}
