package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.config.DetectionThresholdConfig;
import com.ledgerwise.anomaly.model.BaselineMetric;
import com.ledgerwise.anomaly.model.HistoricalBaseline;
import com.ledgerwise.anomaly.model.PreparedBatch;
import com.ledgerwise.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.ledgerwise.anomaly.testutil.TestDataFactory.BASE_TIME;
import static com.ledgerwise.anomaly.testutil.TestDataFactory.HOUR_MS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BaselineServiceTest {

    private DataPreparationService preparationService;
    private BaselineService baselineService;

    @BeforeEach
    void setUp() {
        preparationService = new DataPreparationService();
        baselineService = new BaselineService(preparationService, new DetectionThresholdConfig());
    }

    @Test
    void buildBaseline_computesFieldStatistics() {
        HistoricalBaseline baseline = baselineService.buildBaseline(
                TestDataFactory.dataSource(TestDataFactory.steadySeries("amount", 100, 10), "amount"));

        BaselineMetric metric = baseline.getMetrics().get("amount");
        assertThat(baseline.getSampleCount()).isEqualTo(10);
        assertThat(metric.getMean()).isCloseTo(100.0, within(1e-9));
        assertThat(metric.getStd()).isCloseTo(Math.sqrt(2), within(1e-9));
        assertThat(metric.getMin()).isEqualTo(98.0);
        assertThat(metric.getMax()).isEqualTo(102.0);
        assertThat(metric.getPercentiles()).containsOnlyKeys("p25", "p50", "p75", "p90", "p95", "p99");
        assertThat(metric.getPercentiles().get("p25")).isEqualTo(99.0);
        assertThat(metric.getPercentiles().get("p50")).isEqualTo(100.0);
        assertThat(metric.getPercentiles().get("p99")).isEqualTo(102.0);
        assertThat(baseline.getPeriod().getStart()).isEqualTo(BASE_TIME);
        assertThat(baseline.getPeriod().getEnd()).isEqualTo(BASE_TIME + 9 * HOUR_MS);
    }

    @Test
    void buildBaseline_constantField_hasZeroStd() {
        List<Object> data = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            data.add(TestDataFactory.record(BASE_TIME + i * HOUR_MS, "fee", 25.0));
        }

        HistoricalBaseline baseline = baselineService.buildBaseline(TestDataFactory.dataSource(data, "fee"));

        assertThat(baseline.getMetrics().get("fee").getStd()).isEqualTo(0.0);
        assertThat(baseline.getPatterns()).isEmpty();
    }

    @Test
    void buildBaseline_detectsHourOfDayCycle() {
        List<Object> data = new ArrayList<>();
        for (int i = 0; i < 48; i++) {
            int hour = i % 24;
            data.add(TestDataFactory.record(BASE_TIME + i * HOUR_MS, "amount", hour < 12 ? 100.0 : 200.0));
        }

        HistoricalBaseline baseline = baselineService.buildBaseline(TestDataFactory.dataSource(data, "amount"));

        assertThat(baseline.getPatterns()).hasSize(1);
        assertThat(baseline.getPatterns().get(0).getPattern()).isEqualTo("amount:hour_of_day");
        assertThat(baseline.getPatterns().get(0).getFrequency()).isEqualTo(24);
        assertThat(baseline.getPatterns().get(0).getStrength()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void buildBaseline_tooFewSamples_reportsNoPatterns() {
        HistoricalBaseline baseline = baselineService.buildBaseline(
                TestDataFactory.dataSource(TestDataFactory.steadySeries("amount", 100, 10), "amount"));

        assertThat(baseline.getPatterns()).isEmpty();
    }

    @Test
    void getOrCreate_returnsCachedBaselineWithinTtl() {
        PreparedBatch first = preparationService.prepare(
                TestDataFactory.dataSource(TestDataFactory.steadySeries("amount", 100, 10), "amount"));
        PreparedBatch second = preparationService.prepare(
                TestDataFactory.dataSource(TestDataFactory.steadySeries("amount", 500, 20), "amount"));

        HistoricalBaseline cached = baselineService.getOrCreate("org-1", "src-1", first);
        HistoricalBaseline again = baselineService.getOrCreate("org-1", "src-1", second);

        assertThat(again).isSameAs(cached);
        assertThat(again.getSampleCount()).isEqualTo(10);
    }

    @Test
    void getOrCreate_rebuildsStaleBaseline() {
        HistoricalBaseline stale = TestDataFactory.baseline(3, TestDataFactory.metric("amount", 1, 1));
        stale.setLastUpdated(0L);
        baselineService.replace("org-1", "src-1", stale);

        HistoricalBaseline fresh = baselineService.getOrCreate("org-1", "src-1",
                preparationService.prepare(TestDataFactory.dataSource(
                        TestDataFactory.steadySeries("amount", 100, 10), "amount")));

        assertThat(fresh).isNotSameAs(stale);
        assertThat(fresh.getSampleCount()).isEqualTo(10);
    }

    @Test
    void cache_isKeyedPerOrganizationAndSource() {
        PreparedBatch batch = preparationService.prepare(
                TestDataFactory.dataSource(TestDataFactory.steadySeries("amount", 100, 10), "amount"));

        baselineService.getOrCreate("org-1", "src-1", batch);

        assertThat(baselineService.get("org-1", "src-1")).isNotNull();
        assertThat(baselineService.get("org-2", "src-1")).isNull();

        baselineService.evict("org-1", "src-1");
        assertThat(baselineService.get("org-1", "src-1")).isNull();
    }

    @Test
    void hasSufficientData_comparesSampleCount() {
        HistoricalBaseline baseline = TestDataFactory.baseline(10, TestDataFactory.metric("amount", 100, 5));

        assertThat(baselineService.hasSufficientData(baseline, 10)).isTrue();
        assertThat(baselineService.hasSufficientData(baseline, 11)).isFalse();
        assertThat(baselineService.hasSufficientData(null, 1)).isFalse();
    }
}
