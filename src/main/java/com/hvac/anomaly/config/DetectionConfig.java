package com.hvac.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Threads used for zone-parallel feature, rule and scoring passes.
    private int workerThreads = 4;

    private Features features = new Features();

    private Rules rules = new Rules();

    private Outlier outlier = new Outlier();

    private Batch batch = new Batch();

    @Data
    public static class Features {
        // Nominal interval between samples; also the duration credited to the first sample of an episode.
        private Duration samplingInterval = Duration.ofMinutes(5);
        private Duration shortWindow = Duration.ofMinutes(15);
        private Duration longWindow = Duration.ofMinutes(60);
    }

    @Data
    public static class Rules {
        private TempDrift tempDrift = new TempDrift();
        private CloggedFilter cloggedFilter = new CloggedFilter();
        private CompressorFailure compressorFailure = new CompressorFailure();
        private Oscillation oscillation = new Oscillation();
    }

    @Data
    public static class TempDrift {
        private double errorThresholdC = 3.0;
        private Duration minDuration = Duration.ofMinutes(30);
    }

    @Data
    public static class CloggedFilter {
        // Zone thresholds are max(floor, percentile of the zone's own values).
        private double percentile = 90.0;
        private double fanSpeedFloorPct = 70.0;
        private double powerFloorKw = 0.0;
        // Consecutive samples with both signals elevated.
        private int sustainedSamples = 3;
    }

    @Data
    public static class CompressorFailure {
        // Fractional drop from the lookback peak, 0.5 = power halves.
        private double powerDropFraction = 0.5;
        private Duration lookback = Duration.ofMinutes(15);
        private double minTempRiseC = 0.5;
    }

    @Data
    public static class Oscillation {
        private Duration window = Duration.ofMinutes(60);
        private int maxSignChanges = 6;
    }

    @Data
    public static class Outlier {
        private int numTrees = 100;
        private int sampleSize = 256;
        private long seed = 42L;
        private double contamination = 0.02;
        private int minTrainingRecords = 50;
        private String faultFreeLabel = "none";
        private double mediumSeverityScore = 0.60;
        private double highSeverityScore = 0.70;
        private String modelPath = "data/models/isolation_forest.json";
    }

    @Data
    public static class Batch {
        private String inputPath = "data/raw/hvac_raw.csv";
        private String outputPath = "data/processed/anomalies.csv";
        private boolean persistModel = true;
    }
}
