package com.firmo.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for test run lifecycle events.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * A subscriber that throws is logged and skipped; it never affects the run.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-run subscribers keyed by runId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<FirmoEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<FirmoEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(FirmoEvent event) {
        log.trace("Publishing event: {} for run {}", event.eventType(), event.runId());

        List<Consumer<FirmoEvent>> subs = runSubscribers.get(event.runId());
        if (subs != null) {
            for (Consumer<FirmoEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<FirmoEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one run.
     *
     * @param runId    the run to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String runId, Consumer<FirmoEvent> consumer) {
        runSubscribers.computeIfAbsent(runId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<FirmoEvent>> subs = runSubscribers.get(runId);
            if (subs != null) {
                subs.remove(consumer);
                runSubscribers.remove(runId, List.of());
            }
        };
    }

    public Subscription subscribeAll(Consumer<FirmoEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<FirmoEvent> subscriber, FirmoEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
