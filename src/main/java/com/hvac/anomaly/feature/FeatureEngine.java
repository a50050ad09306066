package com.hvac.anomaly.feature;

import com.hvac.anomaly.config.DetectionConfig;
import com.hvac.anomaly.exception.ValidationException;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns time-ordered readings into enriched readings carrying rolling statistics,
 * lag values and derived error terms.
 *
 * Windowing state is kept per zone and never crosses a zone boundary. Statistics
 * only use history up to the current sample: at stream start the mean is taken over
 * whatever samples exist and the standard deviation stays absent until two are present.
 */
@Component
public class FeatureEngine {

    private static final Logger log = LoggerFactory.getLogger(FeatureEngine.class);

    private final DetectionConfig config;

    public FeatureEngine(DetectionConfig config) {
        this.config = config;
    }

    /**
     * Split an interleaved multi-zone batch by zone, keeping each zone's relative order.
     * Zones are returned in zone id order.
     */
    public Map<String, List<Reading>> splitByZone(List<Reading> readings) {
        Map<String, List<Reading>> byZone = new TreeMap<>();
        for (int i = 0; i < readings.size(); i++) {
            Reading reading = readings.get(i);
            if (reading == null) {
                throw new ValidationException("Reading at index " + i + " is null");
            }
            if (reading.getZoneId() == null || reading.getZoneId().isBlank()) {
                throw new ValidationException("Reading at index " + i + " has no zone id");
            }
            byZone.computeIfAbsent(reading.getZoneId(), z -> new ArrayList<>()).add(reading);
        }
        return byZone;
    }

    /**
     * Enrich a multi-zone batch. Output has the same length and order as the input.
     *
     * @throws ValidationException if any zone's readings are unsorted or contain duplicate timestamps
     */
    public List<EnrichedReading> enrich(List<Reading> readings) {
        Map<String, List<Integer>> indicesByZone = new TreeMap<>();
        for (Map.Entry<String, List<Reading>> entry : splitByZone(readings).entrySet()) {
            indicesByZone.put(entry.getKey(), new ArrayList<>(entry.getValue().size()));
        }
        for (int i = 0; i < readings.size(); i++) {
            indicesByZone.get(readings.get(i).getZoneId()).add(i);
        }

        EnrichedReading[] out = new EnrichedReading[readings.size()];
        for (Map.Entry<String, List<Integer>> entry : indicesByZone.entrySet()) {
            List<Integer> indices = entry.getValue();
            List<Reading> zoneReadings = new ArrayList<>(indices.size());
            for (int idx : indices) {
                zoneReadings.add(readings.get(idx));
            }
            List<EnrichedReading> enriched = enrichZone(entry.getKey(), zoneReadings);
            for (int k = 0; k < indices.size(); k++) {
                out[indices.get(k)] = enriched.get(k);
            }
        }
        return Arrays.asList(out);
    }

    /**
     * Enrich one zone's readings, which must be strictly increasing in timestamp.
     *
     * @throws ValidationException on a foreign zone id, a missing timestamp, or an unsorted/duplicate timestamp
     */
    public List<EnrichedReading> enrichZone(String zoneId, List<Reading> readings) {
        ZoneWindows windows = new ZoneWindows(config.getFeatures());
        List<EnrichedReading> enriched = new ArrayList<>(readings.size());

        Reading previous = null;
        Double previousTempError = null;
        for (int i = 0; i < readings.size(); i++) {
            Reading reading = readings.get(i);
            validate(zoneId, reading, previous, i);

            Instant ts = reading.getTimestamp();
            Double tempError = difference(reading.getTemperatureC(), reading.getSetpointC());
            windows.add(ts, tempError, reading.getPowerKw(), reading.getFanSpeedPct());

            EnrichedReading.EnrichedReadingBuilder builder = EnrichedReading.builder()
                    .reading(reading)
                    .tempErrorC(tempError)
                    .deltaReturnSupplyC(difference(reading.getReturnAirTempC(), reading.getSupplyAirTempC()))
                    .tempErrorMean15m(windows.tempErrorShort.mean())
                    .tempErrorStd15m(windows.tempErrorShort.std())
                    .tempErrorMean60m(windows.tempErrorLong.mean())
                    .tempErrorStd60m(windows.tempErrorLong.std())
                    .powerMean15m(windows.powerShort.mean())
                    .powerStd15m(windows.powerShort.std())
                    .powerMean60m(windows.powerLong.mean())
                    .powerStd60m(windows.powerLong.std())
                    .fanSpeedMean15m(windows.fanShort.mean())
                    .fanSpeedStd15m(windows.fanShort.std())
                    .fanSpeedMean60m(windows.fanLong.mean())
                    .fanSpeedStd60m(windows.fanLong.std());

            if (previous != null) {
                double minutes = Duration.between(previous.getTimestamp(), ts).toMillis() / 60_000.0;
                builder.temperatureLag5m(previous.getTemperatureC())
                        .tempErrorLag5m(previousTempError)
                        .powerLag5m(previous.getPowerKw())
                        .fanSpeedLag5m(previous.getFanSpeedPct())
                        .temperatureRate(rate(reading.getTemperatureC(), previous.getTemperatureC(), minutes))
                        .powerRate(rate(reading.getPowerKw(), previous.getPowerKw(), minutes));
            }

            enriched.add(builder.build());
            previous = reading;
            previousTempError = tempError;
        }

        log.debug("Enriched {} readings for zone {}", enriched.size(), zoneId);
        return enriched;
    }

    private static void validate(String zoneId, Reading reading, Reading previous, int index) {
        if (reading == null) {
            throw new ValidationException("Reading at index " + index + " of zone " + zoneId + " is null");
        }
        if (!zoneId.equals(reading.getZoneId())) {
            throw new ValidationException(String.format(
                    "Reading at index %d belongs to zone %s, expected %s", index, reading.getZoneId(), zoneId));
        }
        if (reading.getTimestamp() == null) {
            throw new ValidationException("Reading at index " + index + " of zone " + zoneId + " has no timestamp");
        }
        if (previous == null) return;

        int cmp = reading.getTimestamp().compareTo(previous.getTimestamp());
        if (cmp == 0) {
            throw new ValidationException(String.format(
                    "Duplicate timestamp %s for zone %s at index %d", reading.getTimestamp(), zoneId, index));
        }
        if (cmp < 0) {
            throw new ValidationException(String.format(
                    "Readings for zone %s are not sorted: %s follows %s at index %d",
                    zoneId, reading.getTimestamp(), previous.getTimestamp(), index));
        }
    }

    private static Double difference(Double a, Double b) {
        if (a == null || b == null) return null;
        return a - b;
    }

    private static Double rate(Double current, Double previous, double minutes) {
        if (current == null || previous == null || minutes <= 0) return null;
        return (current - previous) / minutes;
    }

    /** Rolling buffers for one zone. */
    private static final class ZoneWindows {
        final RollingWindow tempErrorShort;
        final RollingWindow tempErrorLong;
        final RollingWindow powerShort;
        final RollingWindow powerLong;
        final RollingWindow fanShort;
        final RollingWindow fanLong;

        ZoneWindows(DetectionConfig.Features features) {
            tempErrorShort = new RollingWindow(features.getShortWindow());
            tempErrorLong = new RollingWindow(features.getLongWindow());
            powerShort = new RollingWindow(features.getShortWindow());
            powerLong = new RollingWindow(features.getLongWindow());
            fanShort = new RollingWindow(features.getShortWindow());
            fanLong = new RollingWindow(features.getLongWindow());
        }

        void add(Instant ts, Double tempError, Double power, Double fan) {
            tempErrorShort.add(ts, tempError);
            tempErrorLong.add(ts, tempError);
            powerShort.add(ts, power);
            powerLong.add(ts, power);
            fanShort.add(ts, fan);
            fanLong.add(ts, fan);
        }
    }
}
