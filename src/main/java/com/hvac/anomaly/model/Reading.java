package com.hvac.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "A single HVAC sensor sample for one zone")
public class Reading {

    /** Ground-truth label of records known to be fault-free. */
    public static final String NO_FAULT = "none";

    @Schema(description = "Sample timestamp (ISO-8601)", example = "2024-01-03T10:05:00Z")
    Instant timestamp;

    @Schema(description = "Zone identifier", example = "Z3")
    String zoneId;

    @Schema(description = "Air handling unit serving the zone", example = "AHU1")
    String ahuId;

    @Schema(description = "Zone temperature in °C", example = "22.4")
    Double temperatureC;

    @Schema(description = "Temperature setpoint in °C", example = "22.0")
    Double setpointC;

    @Schema(description = "Zone relative humidity in %", example = "45.2")
    Double humidityPct;

    @Schema(description = "Supply air temperature in °C", example = "14.1")
    Double supplyAirTempC;

    @Schema(description = "Return air temperature in °C", example = "23.3")
    Double returnAirTempC;

    @Schema(description = "Electrical power draw in kW", example = "7.4")
    Double powerKw;

    @Schema(description = "Fan speed in % of maximum", example = "61.0")
    Double fanSpeedPct;

    @Schema(description = "Operating mode", example = "cooling")
    HvacMode mode;

    @Schema(description = "Ground-truth fault label, 'none' for fault-free records. Only used to select training data.",
            example = "none")
    String faultType;

    public boolean isFaultFree(String faultFreeLabel) {
        return faultFreeLabel.equals(faultType);
    }

    public boolean isCooling() {
        return mode == HvacMode.COOLING;
    }
}
