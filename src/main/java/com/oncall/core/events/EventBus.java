package com.oncall.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Synchronous, in-memory fan-out of {@link InvestigationEvent}s.
 * <p>
 * Each subscriber carries a filter: one session, one family of event types
 * (matched by dotted prefix), or everything. Events are delivered on the publishing
 * thread in subscription order. A subscriber that throws is logged and counted, and
 * delivery moves on to the next one.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final class Subscriber {
        final Predicate<InvestigationEvent> filter;
        final Consumer<InvestigationEvent> consumer;

        Subscriber(Predicate<InvestigationEvent> filter, Consumer<InvestigationEvent> consumer) {
            this.filter = filter;
            this.consumer = consumer;
        }
    }

    private final List<Subscriber> subscribers = new CopyOnWriteArrayList<>();
    private final AtomicLong failedDeliveries = new AtomicLong();

    public void publish(InvestigationEvent event) {
        log.debug("{} [{}{}]", event.eventType(), event.sessionId(),
                event.deviceName() != null ? "/" + event.deviceName() : "");
        for (Subscriber subscriber : subscribers) {
            if (subscriber.filter.test(event)) {
                deliver(subscriber.consumer, event);
            }
        }
    }

    /**
     * Events of one session only.
     */
    public Subscription subscribe(String sessionId, Consumer<InvestigationEvent> consumer) {
        return add(e -> sessionId.equals(e.sessionId()), consumer);
    }

    /**
     * Events whose type starts with {@code typePrefix}, e.g. {@code "device."}, from every session.
     */
    public Subscription subscribeToType(String typePrefix, Consumer<InvestigationEvent> consumer) {
        return add(e -> e.eventType().startsWith(typePrefix), consumer);
    }

    public Subscription subscribeAll(Consumer<InvestigationEvent> consumer) {
        return add(e -> true, consumer);
    }

    /** Deliveries that ended in a subscriber exception since startup. */
    public long failedDeliveries() {
        return failedDeliveries.get();
    }

    private Subscription add(Predicate<InvestigationEvent> filter, Consumer<InvestigationEvent> consumer) {
        var subscriber = new Subscriber(filter, consumer);
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    private void deliver(Consumer<InvestigationEvent> consumer, InvestigationEvent event) {
        try {
            consumer.accept(event);
        } catch (RuntimeException e) {
            failedDeliveries.incrementAndGet();
            log.warn("Event subscriber failed on {}: {}", event.eventType(), e.getMessage(), e);
        }
    }

    /**
     * Handle of one subscription. Closing it is the same as unsubscribing.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }
}
