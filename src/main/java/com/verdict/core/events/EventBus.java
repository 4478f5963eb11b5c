package com.verdict.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers the events of a run to the consumers subscribed to that run.
 * <p>
 * Consumers are called synchronously on the publishing thread, in subscription order.
 * A consumer that throws is logged and skipped; the run and the other consumers carry on.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<VerdictEvent>>> subscribers = new ConcurrentHashMap<>();

    public void publish(VerdictEvent event) {
        List<Consumer<VerdictEvent>> consumers = subscribers.get(event.runId());
        if (consumers == null) {
            log.trace("No subscriber for {} of run {}", event.eventType(), event.runId());
            return;
        }
        for (Consumer<VerdictEvent> consumer : consumers) {
            deliver(consumer, event);
        }
    }

    /**
     * Subscribes {@code consumer} to the events of {@code runId}. Subscribe before the run
     * starts to receive its {@code run.started} event.
     */
    public Subscription subscribe(String runId, Consumer<VerdictEvent> consumer) {
        subscribers.computeIfAbsent(runId, id -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to run {}", runId);
        return () -> subscribers.computeIfPresent(runId, (id, consumers) -> {
            consumers.remove(consumer);
            return consumers.isEmpty() ? null : consumers;
        });
    }

    /** Number of consumers subscribed to {@code runId}. */
    public int subscriberCount(String runId) {
        List<Consumer<VerdictEvent>> consumers = subscribers.get(runId);
        return consumers == null ? 0 : consumers.size();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Consumer<VerdictEvent> consumer, VerdictEvent event) {
        try {
            consumer.accept(event);
        } catch (RuntimeException e) {
            log.warn("Consumer of run {} failed on {}: {}", event.runId(), event.eventType(), e.getMessage(), e);
        }
    }
}
