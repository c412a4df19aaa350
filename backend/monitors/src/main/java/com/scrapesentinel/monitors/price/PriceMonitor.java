package com.scrapesentinel.monitors.price;

import com.scrapesentinel.core.bus.CallbackDispatcher;
import com.scrapesentinel.core.error.NotFoundException;
import com.scrapesentinel.core.error.PriceParseException;
import com.scrapesentinel.core.events.PriceAlertFired;
import com.scrapesentinel.core.model.ExtractionResult;
import com.scrapesentinel.core.model.FieldValue;
import com.scrapesentinel.core.model.ItemRecord;
import com.scrapesentinel.core.model.PriceAlert;
import com.scrapesentinel.core.model.PriceDirection;
import com.scrapesentinel.core.model.PricePoint;
import com.scrapesentinel.core.model.PriceSummary;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Records price observations and raises an alert when a product's price moves by at least its
 * threshold percentage relative to the previous observation from the same source.
 */
public class PriceMonitor {
    public static final BigDecimal DEFAULT_THRESHOLD_PERCENT = new BigDecimal("5.0");
    public static final String[] CSV_HEADER = {"product_id", "source_id", "price", "timestamp"};

    private static final Logger LOGGER = Logger.getLogger(PriceMonitor.class.getName());
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PriceSeries series;
    private final CallbackDispatcher dispatcher;
    private final Clock clock;
    private final BigDecimal defaultThreshold;
    private final Map<String, BigDecimal> productThresholds = new ConcurrentHashMap<>();

    public PriceMonitor(CallbackDispatcher dispatcher, Clock clock) {
        this(new PriceSeries(), dispatcher, clock, DEFAULT_THRESHOLD_PERCENT, Map.of());
    }

    public PriceMonitor(
            PriceSeries series,
            CallbackDispatcher dispatcher,
            Clock clock,
            BigDecimal defaultThreshold,
            Map<String, BigDecimal> thresholdOverrides
    ) {
        this.series = Objects.requireNonNull(series, "series is required");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.defaultThreshold = requirePositive(defaultThreshold);
        thresholdOverrides.forEach(this::setThreshold);
    }

    public Optional<PriceAlert> track(String productId, String sourceId, BigDecimal price) {
        return track(productId, sourceId, price, clock.instant());
    }

    /**
     * Records the observation and dispatches a {@link PriceAlertFired} when the threshold is crossed.
     */
    public Optional<PriceAlert> track(String productId, String sourceId, BigDecimal price, Instant timestamp) {
        Optional<PriceAlert> alert = record(productId, sourceId, price, timestamp);
        alert.ifPresent(fired -> dispatcher.dispatch(new PriceAlertFired(fired)));
        return alert;
    }

    /**
     * Same as {@link #track(String, String, BigDecimal, Instant)} but leaves delivery of the alert
     * to the caller.
     */
    public Optional<PriceAlert> record(String productId, String sourceId, BigDecimal price, Instant timestamp) {
        if (price.signum() < 0) {
            throw new IllegalArgumentException("price must not be negative: " + price);
        }
        Optional<PricePoint> previous = series.append(new PricePoint(productId, sourceId, price, timestamp));
        if (previous.isEmpty() || previous.get().price().signum() == 0) {
            return Optional.empty();
        }

        BigDecimal prior = previous.get().price();
        BigDecimal pctChange = price.subtract(prior)
                .multiply(HUNDRED)
                .divide(prior, 6, RoundingMode.HALF_UP);
        if (pctChange.abs().compareTo(thresholdFor(productId)) < 0) {
            return Optional.empty();
        }

        PriceAlert alert = new PriceAlert(
                productId,
                sourceId,
                prior,
                price,
                pctChange.setScale(2, RoundingMode.HALF_UP),
                pctChange.signum() < 0 ? PriceDirection.DROP : PriceDirection.INCREASE,
                timestamp
        );
        LOGGER.info(() -> "Price alert for " + productId + "@" + sourceId + ": " + prior.toPlainString()
                + " -> " + price.toPlainString() + " (" + alert.pctChange().toPlainString() + "%)");
        return Optional.of(alert);
    }

    public PriceIngestReport ingestScrapeResults(
            ExtractionResult result,
            String sourceId,
            String priceField,
            String nameField
    ) {
        return ingest(result, sourceId, priceField, nameField, true);
    }

    /**
     * Ingests like {@link #ingestScrapeResults} without dispatching the resulting alerts.
     */
    public PriceIngestReport recordScrapeResults(
            ExtractionResult result,
            String sourceId,
            String priceField,
            String nameField
    ) {
        return ingest(result, sourceId, priceField, nameField, false);
    }

    public PriceSummary summary(String productId) {
        return summarize(productId, null, series.pointsForProduct(productId));
    }

    public PriceSummary summary(String productId, String sourceId) {
        if (sourceId == null) {
            return summary(productId);
        }
        return summarize(productId, sourceId, series.points(productId, sourceId));
    }

    public String exportHistoryCsv() {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(CSV_HEADER)
                .setRecordSeparator("\n")
                .build();
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (PricePoint point : series.allOrdered()) {
                printer.printRecord(
                        point.productId(),
                        point.sourceId(),
                        point.price().toPlainString(),
                        point.timestamp().toString()
                );
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing price history CSV", e);
        }
        return out.toString();
    }

    public void setThreshold(String productId, BigDecimal thresholdPercent) {
        productThresholds.put(productId, requirePositive(thresholdPercent));
    }

    public BigDecimal thresholdFor(String productId) {
        return productThresholds.getOrDefault(productId, defaultThreshold);
    }

    public Set<String> products() {
        return series.products();
    }

    public List<PricePoint> history(String productId) {
        return series.pointsForProduct(productId);
    }

    /**
     * Most recent observation per product, across all sources.
     */
    public Map<String, PricePoint> latestPrices() {
        Map<String, PricePoint> latest = new LinkedHashMap<>();
        for (String productId : series.products()) {
            List<PricePoint> points = series.pointsForProduct(productId);
            if (!points.isEmpty()) {
                latest.put(productId, points.get(points.size() - 1));
            }
        }
        return latest;
    }

    private PriceIngestReport ingest(
            ExtractionResult result,
            String sourceId,
            String priceField,
            String nameField,
            boolean dispatchAlerts
    ) {
        List<PriceAlert> alerts = new ArrayList<>();
        List<PriceIngestReport.ItemError> errors = new ArrayList<>();
        int tracked = 0;
        List<ItemRecord> items = result.items();
        for (int index = 0; index < items.size(); index++) {
            ItemRecord item = items.get(index);
            Optional<FieldValue> name = item.get(nameField);
            Optional<FieldValue> rawPrice = item.get(priceField);
            String productId = name.map(FieldValue::canonical).map(String::trim).orElse("");
            String rawText = rawPrice.map(FieldValue::canonical).orElse(null);
            if (productId.isEmpty()) {
                errors.add(new PriceIngestReport.ItemError(index, null, rawText, "Missing field '" + nameField + "'"));
                continue;
            }
            if (rawPrice.isEmpty()) {
                errors.add(new PriceIngestReport.ItemError(index, productId, null, "Missing field '" + priceField + "'"));
                continue;
            }
            try {
                BigDecimal price = toPrice(rawPrice.get());
                Optional<PriceAlert> alert = dispatchAlerts
                        ? track(productId, sourceId, price, result.extractedAt())
                        : record(productId, sourceId, price, result.extractedAt());
                alert.ifPresent(alerts::add);
                tracked++;
            } catch (PriceParseException | IllegalArgumentException e) {
                errors.add(new PriceIngestReport.ItemError(index, productId, rawText, e.getMessage()));
            }
        }
        if (!errors.isEmpty()) {
            LOGGER.warning("Skipped " + errors.size() + " of " + items.size() + " items from "
                    + result.sourceKey() + " while ingesting prices");
        }
        return new PriceIngestReport(tracked, alerts, errors);
    }

    private static BigDecimal toPrice(FieldValue value) {
        if (value instanceof FieldValue.Decimal decimal) {
            if (decimal.value().signum() < 0) {
                throw new PriceParseException(decimal.canonical(), "Negative price '" + decimal.canonical() + "'");
            }
            return decimal.value();
        }
        if (value instanceof FieldValue.Text text) {
            return PriceParser.parse(text.value());
        }
        throw new PriceParseException(value.canonical(), "Field of type '" + value.tag() + "' is not a price");
    }

    private static PriceSummary summarize(String productId, String sourceId, List<PricePoint> points) {
        if (points.isEmpty()) {
            throw new NotFoundException(sourceId == null
                    ? "No price observations for " + productId
                    : "No price observations for " + productId + " from " + sourceId);
        }
        BigDecimal min = points.get(0).price();
        BigDecimal max = min;
        BigDecimal total = BigDecimal.ZERO;
        int scale = 2;
        for (PricePoint point : points) {
            BigDecimal price = point.price();
            min = price.compareTo(min) < 0 ? price : min;
            max = price.compareTo(max) > 0 ? price : max;
            total = total.add(price);
            scale = Math.max(scale, price.scale());
        }
        PricePoint current = points.stream()
                .max(Comparator.comparing(PricePoint::timestamp))
                .orElseThrow();
        BigDecimal average = total.divide(BigDecimal.valueOf(points.size()), scale, RoundingMode.HALF_UP);
        return new PriceSummary(productId, sourceId, current.price(), min, max, average, points.size());
    }

    private static BigDecimal requirePositive(BigDecimal thresholdPercent) {
        Objects.requireNonNull(thresholdPercent, "thresholdPercent is required");
        if (thresholdPercent.signum() <= 0) {
            throw new IllegalArgumentException("threshold must be positive: " + thresholdPercent);
        }
        return thresholdPercent;
    }
}
