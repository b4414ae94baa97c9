package com.toolgate.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for gatekeeper events.
 * <p>
 * Supports per-tool subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations. A failing subscriber
 * never affects the publisher.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-tool subscribers keyed by tool name. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<GateEvent>>> toolSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<GateEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (tool-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(GateEvent event) {
        log.debug("Publishing event: {} for tool {}", event.eventType(), event.toolName());

        if (event.toolName() != null) {
            List<Consumer<GateEvent>> toolSubs = toolSubscribers.get(event.toolName());
            if (toolSubs != null) {
                for (Consumer<GateEvent> subscriber : toolSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<GateEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific tool.
     *
     * @param toolName the tool to subscribe to
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String toolName, Consumer<GateEvent> consumer) {
        toolSubscribers.computeIfAbsent(toolName, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to tool {}", toolName);
        return () -> {
            CopyOnWriteArrayList<Consumer<GateEvent>> subs = toolSubscribers.get(toolName);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to every event (global subscription).
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<GateEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<GateEvent> subscriber, GateEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
