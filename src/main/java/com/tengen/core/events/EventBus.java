package com.tengen.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for game lifecycle events.
 * <p>
 * Supports per-type subscriptions and global subscriptions that receive all events.
 * Events are delivered on the publishing thread; a subscriber that throws does not
 * affect the publisher or the other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Subscribers keyed by event type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<GameEvent>>> typeSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<GameEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(GameEvent event) {
        log.debug("Publishing event: {} for game {}", event.eventType(), event.gameId());

        List<Consumer<GameEvent>> typeSubs = typeSubscribers.get(event.eventType());
        if (typeSubs != null) {
            for (Consumer<GameEvent> subscriber : typeSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<GameEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to one event type.
     *
     * @param eventType e.g. {@link GameEvent#LOADED}
     * @param consumer  callback invoked for each matching event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String eventType, Consumer<GameEvent> consumer) {
        typeSubscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to {}", eventType);
        return () -> {
            CopyOnWriteArrayList<Consumer<GameEvent>> subs = typeSubscribers.get(eventType);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<GameEvent> consumer) {
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

    private void deliverSafely(Consumer<GameEvent> subscriber, GameEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
