package com.hvac.anomaly.engine.isolationforest;

import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Reading;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Extracts the 11-dimensional outlier feature vector from an enriched reading.
 * Order and identity are a stable contract between training and scoring.
 *
 * Features:
 *   [0]  Zone temperature (°C)
 *   [1]  Temperature error from setpoint (°C)
 *   [2]  Power (kW)
 *   [3]  Fan speed (%)
 *   [4]  Return - supply air temperature (°C)
 *   [5]  60-min rolling mean of temperature error
 *   [6]  60-min rolling std of temperature error
 *   [7]  60-min rolling mean of power
 *   [8]  60-min rolling std of power
 *   [9]  Temperature rate of change (°C/min)
 *   [10] Power rate of change (kW/min)
 *
 * Absent values are imputed with the training-set median of the feature.
 */
public final class FeatureExtractor {

    public static final List<String> FEATURE_NAMES = List.of(
            "temp_zone_c",
            "temp_error_c",
            "power_kw",
            "fan_speed_pct",
            "delta_return_supply",
            "temp_error_rolling_mean_60min",
            "temp_error_rolling_std_60min",
            "power_rolling_mean_60min",
            "power_rolling_std_60min",
            "temp_change_rate",
            "power_change_rate"
    );

    public static final int FEATURE_COUNT = FEATURE_NAMES.size();

    private FeatureExtractor() {}

    /** Raw feature values; absent entries are null. */
    public static Double[] extract(EnrichedReading enriched) {
        Reading reading = enriched.getReading();
        return new Double[] {
                reading.getTemperatureC(),
                enriched.getTempErrorC(),
                reading.getPowerKw(),
                reading.getFanSpeedPct(),
                enriched.getDeltaReturnSupplyC(),
                enriched.getTempErrorMean60m(),
                enriched.getTempErrorStd60m(),
                enriched.getPowerMean60m(),
                enriched.getPowerStd60m(),
                enriched.getTemperatureRate(),
                enriched.getPowerRate()
        };
    }

    /**
     * Per-feature median over present values; 0.0 for a feature with no present value.
     */
    public static double[] medians(List<Double[]> rows) {
        double[] medians = new double[FEATURE_COUNT];
        for (int f = 0; f < FEATURE_COUNT; f++) {
            List<Double> present = new ArrayList<>(rows.size());
            for (Double[] row : rows) {
                if (isPresent(row[f])) present.add(row[f]);
            }
            if (present.isEmpty()) {
                medians[f] = 0.0;
                continue;
            }
            double[] sorted = present.stream().mapToDouble(Double::doubleValue).toArray();
            Arrays.sort(sorted);
            int mid = sorted.length / 2;
            medians[f] = sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
        return medians;
    }

    public static double[] impute(Double[] raw, double[] imputationValues) {
        double[] features = new double[FEATURE_COUNT];
        for (int f = 0; f < FEATURE_COUNT; f++) {
            features[f] = isPresent(raw[f]) ? raw[f] : imputationValues[f];
        }
        return features;
    }

    private static boolean isPresent(Double value) {
        return value != null && !value.isNaN() && !value.isInfinite();
    }
}
