package com.scrapesentinel.monitors.api;

import com.scrapesentinel.core.events.Event;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Outcome of one successful fetch and extraction. Nothing has been written to the shared stores
 * yet: {@link #commit()} applies the run's writes and returns the events they produced. The
 * scheduler commits only runs it accepts, so a run that was cancelled or timed out leaves the
 * stores untouched.
 */
public record JobRunResult(String message, Map<String, Object> stats, Supplier<Committed> writes) {
    public JobRunResult {
        Objects.requireNonNull(message, "message is required");
        Objects.requireNonNull(writes, "writes is required");
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    /**
     * A result whose commit writes nothing and yields {@code events} as they are.
     */
    public JobRunResult(String message, Map<String, Object> stats, List<Event> events) {
        this(message, stats, () -> new Committed(Map.of(), events));
    }

    public static JobRunResult of(String message) {
        return new JobRunResult(message, Map.of(), List.of());
    }

    /**
     * Applies the pending writes. The returned stats are this result's stats plus whatever the
     * writes reported.
     */
    public Committed commit() {
        Committed applied = writes.get();
        Map<String, Object> merged = new HashMap<>(stats);
        merged.putAll(applied.stats());
        return new Committed(merged, applied.events());
    }

    public record Committed(Map<String, Object> stats, List<Event> events) {
        public Committed {
            stats = stats == null ? Map.of() : Map.copyOf(stats);
            events = events == null ? List.of() : List.copyOf(events);
        }
    }
}
