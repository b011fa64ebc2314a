package com.airledger.core.bus;

import com.airledger.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process fan-out of pipeline events (ticks, rejections, compliance events, ledger
 * appends). Handlers run on the publishing thread: typed handlers in registration order, then the
 * handlers registered through {@link #subscribeAll}. A failing handler is reported through
 * {@code onHandlerError} and never reaches the publisher.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Subscription<?>>> typed = new ConcurrentHashMap<>();
    private final List<Subscription<Event>> everyType = new CopyOnWriteArrayList<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Event handler failed for " + event.type(), ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        typed.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(new Subscription<>(type, handler));
    }

    public void subscribeAll(Consumer<Event> handler) {
        everyType.add(new Subscription<>(Event.class, handler));
    }

    public void publish(Event event) {
        for (Subscription<?> subscription : typed.getOrDefault(event.getClass(), List.of())) {
            deliver(subscription, event);
        }
        for (Subscription<Event> subscription : everyType) {
            deliver(subscription, event);
        }
    }

    private void deliver(Subscription<?> subscription, Event event) {
        try {
            subscription.accept(event);
        } catch (Exception ex) {
            onHandlerError.accept(event, ex);
        }
    }

    private record Subscription<T extends Event>(Class<T> type, Consumer<T> handler) {
        void accept(Event event) {
            handler.accept(type.cast(event));
        }
    }
}
