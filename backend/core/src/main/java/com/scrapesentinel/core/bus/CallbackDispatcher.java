package com.scrapesentinel.core.bus;

import com.scrapesentinel.core.error.HandlerException;
import com.scrapesentinel.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans events out to the handlers registered for their exact type, in registration order.
 * A handler that throws is reported to the error callback and the remaining handlers still run.
 */
public class CallbackDispatcher {
    private static final Logger LOGGER = Logger.getLogger(CallbackDispatcher.class.getName());

    private final Map<Class<? extends Event>, CopyOnWriteArrayList<Consumer<? extends Event>>> handlers =
            new ConcurrentHashMap<>();
    private final BiConsumer<Event, HandlerException> onHandlerError;

    public CallbackDispatcher() {
        this((event, ex) -> LOGGER.log(Level.WARNING, ex.getMessage(), ex.getCause()));
    }

    public CallbackDispatcher(BiConsumer<Event, HandlerException> onHandlerError) {
        this.onHandlerError = onHandlerError;
    }

    public <T extends Event> void register(Class<T> eventType, Consumer<T> handler) {
        handlers.computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public void dispatch(Event event) {
        List<Consumer<? extends Event>> registered = handlers.get(event.getClass());
        if (registered == null) {
            return;
        }
        for (Consumer<? extends Event> rawHandler : registered) {
            invokeHandler(rawHandler, event);
        }
    }

    public void dispatchAll(List<? extends Event> events) {
        for (Event event : events) {
            dispatch(event);
        }
    }

    public int handlerCount(Class<? extends Event> eventType) {
        List<Consumer<? extends Event>> registered = handlers.get(eventType);
        return registered == null ? 0 : registered.size();
    }

    @SuppressWarnings("unchecked")
    private <T extends Event> void invokeHandler(Consumer<? extends Event> rawHandler, Event event) {
        try {
            Consumer<T> typedHandler = (Consumer<T>) rawHandler;
            typedHandler.accept((T) event);
        } catch (Exception ex) {
            HandlerException failure = new HandlerException(event.type(), ex);
            try {
                onHandlerError.accept(event, failure);
            } catch (RuntimeException reportFailure) {
                LOGGER.log(Level.SEVERE, "Handler error callback failed for " + event.type(), reportFailure);
            }
        }
    }
}
