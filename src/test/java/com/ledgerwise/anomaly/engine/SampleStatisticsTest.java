package com.ledgerwise.anomaly.engine;

import com.ledgerwise.anomaly.model.BaselineMetric;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SampleStatisticsTest {

    @Test
    void populationStd_constantSample_isExactlyZero() {
        double[] values = {0.1 + 0.2, 0.3, 0.30000000000000004};
        double mean = SampleStatistics.mean(values);

        assertThat(SampleStatistics.populationStd(values, mean)).isEqualTo(0.0);
    }

    @Test
    void zScore_zeroStd_returnsZero() {
        assertThat(SampleStatistics.zScore(1_000_000, 5, 0.0)).isEqualTo(0.0);
        assertThat(SampleStatistics.zScore(130, 100, 10)).isCloseTo(3.0, within(1e-12));
    }

    @Test
    void percentile_usesNearestRank() {
        double[] sorted = {1, 2, 3, 4};

        assertThat(SampleStatistics.percentile(sorted, 25)).isEqualTo(2.0);
        assertThat(SampleStatistics.percentile(sorted, 50)).isEqualTo(3.0);
        assertThat(SampleStatistics.percentile(sorted, 99)).isEqualTo(4.0);
        assertThat(SampleStatistics.percentile(new double[0], 50)).isEqualTo(0.0);
    }

    @Test
    void twoSidedTailProbability_matchesNormalTable() {
        assertThat(SampleStatistics.twoSidedTailProbability(0)).isCloseTo(1.0, within(1e-6));
        assertThat(SampleStatistics.twoSidedTailProbability(1.96)).isCloseTo(0.05, within(1e-3));
        assertThat(SampleStatistics.twoSidedTailProbability(-3)).isCloseTo(0.0027, within(1e-4));
    }

    @Test
    void percentileRank_interpolatesBetweenStoredPercentiles() {
        Map<String, Double> percentiles = new LinkedHashMap<>();
        percentiles.put("p25", 25.0);
        percentiles.put("p50", 50.0);
        percentiles.put("p75", 75.0);
        percentiles.put("p90", 90.0);
        percentiles.put("p95", 95.0);
        percentiles.put("p99", 99.0);
        BaselineMetric metric = BaselineMetric.builder().field("x").min(0).max(100).percentiles(percentiles).build();

        assertThat(SampleStatistics.percentileRank(-5, metric)).isEqualTo(0.0);
        assertThat(SampleStatistics.percentileRank(37.5, metric)).isCloseTo(37.5, within(1e-9));
        assertThat(SampleStatistics.percentileRank(99.5, metric)).isCloseTo(99.5, within(1e-9));
        assertThat(SampleStatistics.percentileRank(150, metric)).isEqualTo(100.0);
    }
}
