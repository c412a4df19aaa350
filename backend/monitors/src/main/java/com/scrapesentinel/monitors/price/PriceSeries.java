package com.scrapesentinel.monitors.price;

import com.scrapesentinel.core.model.PricePoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Append-only price observations per (product, source). Every series is strictly ordered by
 * timestamp and guarded by its own lock.
 */
public class PriceSeries {
    private final Map<SeriesKey, Series> series = new ConcurrentHashMap<>();

    /**
     * @return the point that was last in the series before this append, if any
     * @throws IllegalArgumentException if the point is not strictly later than the series' last point
     */
    public Optional<PricePoint> append(PricePoint point) {
        Series target = series.computeIfAbsent(new SeriesKey(point.productId(), point.sourceId()), ignored -> new Series());
        return target.locked(() -> {
            PricePoint last = target.points.isEmpty() ? null : target.points.get(target.points.size() - 1);
            if (last != null && !point.timestamp().isAfter(last.timestamp())) {
                throw new IllegalArgumentException("Observation at " + point.timestamp()
                        + " is not after the latest one at " + last.timestamp()
                        + " for " + point.productId() + "/" + point.sourceId());
            }
            target.points.add(point);
            return Optional.ofNullable(last);
        });
    }

    public List<PricePoint> points(String productId, String sourceId) {
        Series target = series.get(new SeriesKey(productId, sourceId));
        if (target == null) {
            return List.of();
        }
        return target.locked(() -> List.copyOf(target.points));
    }

    public List<PricePoint> pointsForProduct(String productId) {
        List<PricePoint> points = new ArrayList<>();
        for (SeriesKey key : keys()) {
            if (key.productId().equals(productId)) {
                points.addAll(points(key.productId(), key.sourceId()));
            }
        }
        points.sort(Comparator.comparing(PricePoint::timestamp));
        return points;
    }

    /**
     * All observations ordered by product, then source, then timestamp.
     */
    public List<PricePoint> allOrdered() {
        List<PricePoint> points = new ArrayList<>();
        for (SeriesKey key : keys()) {
            points.addAll(points(key.productId(), key.sourceId()));
        }
        return points;
    }

    public Set<SeriesKey> keys() {
        return new TreeSet<>(series.keySet());
    }

    public Set<String> products() {
        Set<String> products = new TreeSet<>();
        for (SeriesKey key : series.keySet()) {
            products.add(key.productId());
        }
        return products;
    }

    public record SeriesKey(String productId, String sourceId) implements Comparable<SeriesKey> {
        private static final Comparator<SeriesKey> ORDER =
                Comparator.comparing(SeriesKey::productId).thenComparing(SeriesKey::sourceId);

        @Override
        public int compareTo(SeriesKey other) {
            return ORDER.compare(this, other);
        }
    }

    private static final class Series {
        private final ReentrantLock lock = new ReentrantLock();
        private final List<PricePoint> points = new ArrayList<>();

        private <T> T locked(Supplier<T> action) {
            lock.lock();
            try {
                return action.get();
            } finally {
                lock.unlock();
            }
        }
    }
}
