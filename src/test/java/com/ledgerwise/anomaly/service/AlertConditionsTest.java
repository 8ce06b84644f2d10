package com.ledgerwise.anomaly.service;

import com.ledgerwise.anomaly.model.*;
import com.ledgerwise.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertConditionsTest {

    private static DetectedAnomaly financialHigh() {
        DetectedAnomaly anomaly = TestDataFactory.anomaly("amount", Severity.HIGH, 4.0, 1L);
        anomaly.setBusinessImpact(new BusinessImpactAssessor().assess(anomaly, null));
        return anomaly;
    }

    @Test
    void matches_wildcards() {
        DetectedAnomaly anomaly = financialHigh();

        assertThat(AlertConditions.matches(null, anomaly)).isTrue();
        assertThat(AlertConditions.matches(" ", anomaly)).isTrue();
        assertThat(AlertConditions.matches("*", anomaly)).isTrue();
        assertThat(AlertConditions.matches("ALL", anomaly)).isTrue();
    }

    @Test
    void matches_singleClause_ignoresCase() {
        DetectedAnomaly anomaly = financialHigh();

        assertThat(AlertConditions.matches("severity:high", anomaly)).isTrue();
        assertThat(AlertConditions.matches("field=AMOUNT", anomaly)).isTrue();
        assertThat(AlertConditions.matches("category:financial", anomaly)).isTrue();
        assertThat(AlertConditions.matches("urgency:urgent", anomaly)).isTrue();
        assertThat(AlertConditions.matches("algorithm:statistical", anomaly)).isTrue();
        assertThat(AlertConditions.matches("type:point", anomaly)).isTrue();
        assertThat(AlertConditions.matches("severity:low", anomaly)).isFalse();
    }

    @Test
    void matches_alternativesAndConjunction() {
        DetectedAnomaly anomaly = financialHigh();

        assertThat(AlertConditions.matches("severity:critical|high", anomaly)).isTrue();
        assertThat(AlertConditions.matches("severity:high && field:amount", anomaly)).isTrue();
        assertThat(AlertConditions.matches("severity:high && field:fee", anomaly)).isFalse();
    }

    @Test
    void matches_unknownKeyOrMalformedClause_neverMatches() {
        DetectedAnomaly anomaly = financialHigh();

        assertThat(AlertConditions.matches("owner:alice", anomaly)).isFalse();
        assertThat(AlertConditions.matches("severity", anomaly)).isFalse();
        assertThat(AlertConditions.matches("severity:", anomaly)).isFalse();
    }

    @Test
    void matches_categoryWithoutImpact_doesNotMatch() {
        DetectedAnomaly anomaly = TestDataFactory.anomaly("amount", Severity.HIGH, 4.0, 1L);

        assertThat(AlertConditions.matches("category:financial", anomaly)).isFalse();
    }
}
