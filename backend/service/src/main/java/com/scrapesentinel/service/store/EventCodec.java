package com.scrapesentinel.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scrapesentinel.core.bus.CallbackDispatcher;
import com.scrapesentinel.core.events.ChangeDetected;
import com.scrapesentinel.core.events.DiffComputed;
import com.scrapesentinel.core.events.Event;
import com.scrapesentinel.core.events.JobFailed;
import com.scrapesentinel.core.events.JobSucceeded;
import com.scrapesentinel.core.events.PriceAlertFired;
import com.scrapesentinel.core.util.JsonUtils;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * JSON line form of dispatched events: {@code {"type":...,"timestamp":...,"event":{...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final List<Class<? extends Event>> TYPES = List.of(
            JobSucceeded.class,
            JobFailed.class,
            ChangeDetected.class,
            DiffComputed.class,
            PriceAlertFired.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return TYPES;
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new LoggedEvent(event.type(), event.timestamp(), event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static void subscribeAll(CallbackDispatcher dispatcher, Consumer<Event> consumer) {
        for (Class<? extends Event> type : TYPES) {
            register(dispatcher, type, consumer);
        }
    }

    private static <T extends Event> void register(CallbackDispatcher dispatcher, Class<T> type, Consumer<Event> consumer) {
        dispatcher.register(type, consumer::accept);
    }

    private record LoggedEvent(String type, Instant timestamp, Event event) {
    }
}
