package com.hvac.anomaly.model;

import java.util.function.Function;

/**
 * Raw sensor metrics carried by a {@link Reading}, with the column names used
 * in exported data and in {@link AnomalyEvent#getMetric()}.
 */
public enum Metric {
    TEMPERATURE("temp_zone_c", Reading::getTemperatureC),
    SETPOINT("setpoint_c", Reading::getSetpointC),
    HUMIDITY("rh_zone_pct", Reading::getHumidityPct),
    SUPPLY_AIR_TEMP("supply_air_temp_c", Reading::getSupplyAirTempC),
    RETURN_AIR_TEMP("return_air_temp_c", Reading::getReturnAirTempC),
    POWER("power_kw", Reading::getPowerKw),
    FAN_SPEED("fan_speed_pct", Reading::getFanSpeedPct);

    private final String column;
    private final Function<Reading, Double> extractor;

    Metric(String column, Function<Reading, Double> extractor) {
        this.column = column;
        this.extractor = extractor;
    }

    public String getColumn() {
        return column;
    }

    public Double valueOf(Reading reading) {
        return extractor.apply(reading);
    }
}
