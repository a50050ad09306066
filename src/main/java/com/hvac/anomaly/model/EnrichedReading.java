package com.hvac.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A {@link Reading} with windowed statistics, lags and derived error terms.
 * Any derived field is {@code null} when it cannot be computed from the history
 * seen so far in the zone's stream.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Sensor reading enriched with rolling statistics, lag values and derived error terms")
public class EnrichedReading {

    Reading reading;

    @Schema(description = "temperature - setpoint in °C")
    Double tempErrorC;

    @Schema(description = "return air - supply air temperature in °C")
    Double deltaReturnSupplyC;

    Double tempErrorMean15m;
    Double tempErrorStd15m;
    Double tempErrorMean60m;
    Double tempErrorStd60m;

    Double powerMean15m;
    Double powerStd15m;
    Double powerMean60m;
    Double powerStd60m;

    Double fanSpeedMean15m;
    Double fanSpeedStd15m;
    Double fanSpeedMean60m;
    Double fanSpeedStd60m;

    @Schema(description = "Value one sample (5 minutes) back")
    Double temperatureLag5m;
    Double tempErrorLag5m;
    Double powerLag5m;
    Double fanSpeedLag5m;

    @Schema(description = "First difference per minute of elapsed time")
    Double temperatureRate;
    Double powerRate;

    @JsonIgnore
    public Instant getTimestamp() {
        return reading.getTimestamp();
    }

    @JsonIgnore
    public String getZoneId() {
        return reading.getZoneId();
    }

    @JsonIgnore
    public String getAhuId() {
        return reading.getAhuId();
    }
}
