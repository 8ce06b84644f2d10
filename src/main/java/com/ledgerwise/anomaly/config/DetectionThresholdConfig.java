package com.ledgerwise.anomaly.config;

import com.ledgerwise.anomaly.model.CustomThresholds;
import com.ledgerwise.anomaly.model.DetectionConfiguration;
import com.ledgerwise.anomaly.model.Sensitivity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionThresholdConfig {

    // z-score thresholds per sensitivity. Higher sensitivity = lower threshold.
    private double lowSensitivityZ = 3.0;
    private double mediumSensitivityZ = 2.5;
    private double highSensitivityZ = 2.0;

    // Added to the averaged confidence of anomalies found by more than one algorithm
    private double ensembleBoost = 0.1;

    // Used when the request's minimumSamples is 0 or negative
    private int defaultMinimumSamples = 10;

    // Records on each side of an anomaly copied into its context
    private int surroundingWindow = 5;

    // More anomalies than this in one run triggers a process-improvement recommendation
    private int recommendationAnomalyThreshold = 10;

    private String modelVersion = "1.0.0";

    private Isolation isolation = new Isolation();

    private OneClass oneClass = new OneClass();

    private Baseline baseline = new Baseline();

    private Stream stream = new Stream();

    private Executor executor = new Executor();

    @Data
    public static class Isolation {
        private int numTrees = 100;
        private int sampleSize = 256;
        private long seed = 42L;
        private double threshold = 0.6;
    }

    @Data
    public static class OneClass {
        // Expected outlier fraction; the boundary radius is the (1 - nu) distance quantile
        private double nu = 0.05;
    }

    @Data
    public static class Baseline {
        private Duration cacheTtl = Duration.ofHours(24);
        private double minPatternStrength = 0.3;
    }

    @Data
    public static class Stream {
        private int maxQueuedBatches = 16;
    }

    @Data
    public static class Executor {
        private int detectionThreads = 4;
        private int enrichmentThreads = 2;
    }

    public double resolveZScoreThreshold(DetectionConfiguration config) {
        CustomThresholds custom = config.getCustomThresholds();
        if (custom != null && custom.getStatisticalThreshold() > 0) {
            return custom.getStatisticalThreshold();
        }
        Sensitivity sensitivity = config.getSensitivity() == null ? Sensitivity.MEDIUM : config.getSensitivity();
        return switch (sensitivity) {
            case LOW -> lowSensitivityZ;
            case HIGH -> highSensitivityZ;
            case MEDIUM, CUSTOM -> mediumSensitivityZ;
        };
    }

    public int resolveMinimumSamples(DetectionConfiguration config) {
        return config.getMinimumSamples() > 0 ? config.getMinimumSamples() : defaultMinimumSamples;
    }
}
