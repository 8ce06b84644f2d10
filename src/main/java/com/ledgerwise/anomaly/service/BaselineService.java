package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.engine.SampleStatistics;
import com.ledgerwise.anomaly.model.BaselineMetric;
import com.ledgerwise.anomaly.model.BaselinePattern;
import com.ledgerwise.anomaly.model.DataSource;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.model.PreparedRecord;
import com.ledgerwise.anomaly.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToIntFunction;

/**
 * Builds per-field baselines and caches one per (organization, data source).
 * Cached baselines are never mutated; a refresh replaces the entry.
 */
@Service
public class BaselineService {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final DataPreparationService preparationService;
    private final DetectionThresholdConfig config;

    // "orgId:sourceId" -> baseline
    private final ConcurrentHashMap<String, HistoricalBaseline> cache = new ConcurrentHashMap<>();

    public BaselineService(DataPreparationService preparationService, DetectionThresholdConfig config) {
        this.preparationService = preparationService;
        this.config = config;
    }

    public HistoricalBaseline buildBaseline(DataSource dataSource) {
        return buildBaseline(preparationService.prepare(dataSource));
    }

    public HistoricalBaseline buildBaseline(PreparedBatch batch) {
        List<PreparedRecord> records = batch.getRecords();
        Map<String, BaselineMetric> metrics = new LinkedHashMap<>();
        List<BaselinePattern> patterns = new ArrayList<>();

        for (String field : batch.getValueFields()) {
            double[] values = new double[records.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = records.get(i).getValues().getOrDefault(field, 0.0);
            }
            metrics.put(field, buildMetric(field, values));
            patterns.addAll(detectPatterns(field, records));
        }

        Long start = null;
        Long end = null;
        for (PreparedRecord record : records) {
            Long ts = record.getTimestamp();
            if (ts == null) continue;
            start = start == null ? ts : Math.min(start, ts);
            end = end == null ? ts : Math.max(end, ts);
        }

        return HistoricalBaseline.builder()
                .period(start == null ? null : new TimeRange(start, end))
                .metrics(metrics)
                .patterns(patterns)
                .sampleCount(records.size())
                .lastUpdated(System.currentTimeMillis())
                .build();
    }

    /**
     * Return the cached baseline for the source, building it from {@code batch} when missing
     * or older than the configured TTL.
     */
    public HistoricalBaseline getOrCreate(String organizationId, String sourceId, PreparedBatch batch) {
        long ttlMs = config.getBaseline().getCacheTtl().toMillis();
        return cache.compute(cacheKey(organizationId, sourceId), (key, existing) -> {
            if (existing != null && System.currentTimeMillis() - existing.getLastUpdated() <= ttlMs) {
                return existing;
            }
            HistoricalBaseline fresh = buildBaseline(batch);
            log.info("Built baseline for {}: samples={}, fields={}, patterns={}",
                    key, fresh.getSampleCount(), fresh.getMetrics().size(), fresh.getPatterns().size());
            return fresh;
        });
    }

    public HistoricalBaseline getOrCreate(String organizationId, String sourceId, DataSource dataSource) {
        return getOrCreate(organizationId, sourceId, preparationService.prepare(dataSource));
    }

    public HistoricalBaseline get(String organizationId, String sourceId) {
        return cache.get(cacheKey(organizationId, sourceId));
    }

    public void replace(String organizationId, String sourceId, HistoricalBaseline baseline) {
        cache.put(cacheKey(organizationId, sourceId), baseline);
    }

    public void evict(String organizationId, String sourceId) {
        cache.remove(cacheKey(organizationId, sourceId));
    }

    public boolean hasSufficientData(HistoricalBaseline baseline, int minimumSamples) {
        return baseline != null && baseline.getSampleCount() >= minimumSamples;
    }

    private BaselineMetric buildMetric(String field, double[] values) {
        double mean = SampleStatistics.mean(values);
        double std = SampleStatistics.populationStd(values, mean);
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        Map<String, Double> percentiles = new LinkedHashMap<>();
        for (int p : SampleStatistics.PERCENTILES) {
            percentiles.put("p" + p, SampleStatistics.percentile(sorted, p));
        }

        return BaselineMetric.builder()
                .field(field)
                .mean(mean)
                .std(std)
                .min(sorted.length == 0 ? 0.0 : sorted[0])
                .max(sorted.length == 0 ? 0.0 : sorted[sorted.length - 1])
                .percentiles(percentiles)
                .build();
    }

    private List<BaselinePattern> detectPatterns(String field, List<PreparedRecord> records) {
        List<PreparedRecord> timed = records.stream().filter(r -> r.getTimestamp() != null).toList();
        List<BaselinePattern> patterns = new ArrayList<>(2);
        addIfStrong(patterns, field, "hour_of_day", 24, timed, ZonedDateTime::getHour);
        addIfStrong(patterns, field, "day_of_week", 7, timed, t -> t.getDayOfWeek().getValue() % 7);
        return patterns;
    }

    /**
     * Strength is the share of variance explained by the cycle bucket (eta squared).
     * Needs at least two samples per possible bucket on average to be considered.
     */
    private void addIfStrong(List<BaselinePattern> patterns, String field, String name, int frequency,
                             List<PreparedRecord> timed, ToIntFunction<ZonedDateTime> bucketOf) {
        if (timed.size() < 2 * frequency) return;

        double[] sums = new double[frequency];
        int[] counts = new int[frequency];
        double total = 0.0;
        long lastSeen = 0L;
        for (PreparedRecord record : timed) {
            ZonedDateTime time = Instant.ofEpochMilli(record.getTimestamp()).atZone(ZoneOffset.UTC);
            int bucket = bucketOf.applyAsInt(time);
            double value = record.getValues().getOrDefault(field, 0.0);
            sums[bucket] += value;
            counts[bucket]++;
            total += value;
            lastSeen = Math.max(lastSeen, record.getTimestamp());
        }

        int occupied = 0;
        for (int c : counts) if (c > 0) occupied++;
        if (occupied < 2) return;

        double grandMean = total / timed.size();
        double totalVar = 0.0;
        for (PreparedRecord record : timed) {
            double d = record.getValues().getOrDefault(field, 0.0) - grandMean;
            totalVar += d * d;
        }
        if (totalVar <= 0) return;

        double betweenVar = 0.0;
        for (int b = 0; b < frequency; b++) {
            if (counts[b] == 0) continue;
            double d = sums[b] / counts[b] - grandMean;
            betweenVar += counts[b] * d * d;
        }

        double strength = Math.min(1.0, betweenVar / totalVar);
        if (strength >= config.getBaseline().getMinPatternStrength()) {
            patterns.add(BaselinePattern.builder()
                    .pattern(field + ":" + name)
                    .frequency(frequency)
                    .strength(strength)
                    .lastSeen(lastSeen)
                    .build());
        }
    }

    private static String cacheKey(String organizationId, String sourceId) {
        return organizationId + ":" + sourceId;
    }
}
