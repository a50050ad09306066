package com.hvac.anomaly.service;

import com.hvac.anomaly.exception.ValidationException;
import com.hvac.anomaly.model.HvacMode;
import com.hvac.anomaly.model.Reading;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static com.hvac.anomaly.testutil.TestDataFactory.at;
import static com.hvac.anomaly.testutil.TestDataFactory.baseReading;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReadingCsvLoaderTest {

    private static final String HEADER = "timestamp,zone_id,ahu_id,temp_zone_c,setpoint_c,rh_zone_pct,"
            + "supply_air_temp_c,return_air_temp_c,power_kw,fan_speed_pct,mode,fault_type\n";

    private final ReadingCsvLoader loader = new ReadingCsvLoader();

    @Test
    void load_parsesProducerColumns() throws Exception {
        String csv = HEADER
                + "2024-01-01 00:05:00,Z1,AHU1,22.4,22.0,45.1,14.2,23.1,7.5,60.0,cooling,none\n";

        List<Reading> readings = loader.load(new StringReader(csv));

        assertThat(readings).hasSize(1);
        Reading reading = readings.get(0);
        assertThat(reading.getTimestamp()).isEqualTo(Instant.parse("2024-01-01T00:05:00Z"));
        assertThat(reading.getZoneId()).isEqualTo("Z1");
        assertThat(reading.getAhuId()).isEqualTo("AHU1");
        assertThat(reading.getTemperatureC()).isEqualTo(22.4);
        assertThat(reading.getSetpointC()).isEqualTo(22.0);
        assertThat(reading.getHumidityPct()).isEqualTo(45.1);
        assertThat(reading.getSupplyAirTempC()).isEqualTo(14.2);
        assertThat(reading.getReturnAirTempC()).isEqualTo(23.1);
        assertThat(reading.getPowerKw()).isEqualTo(7.5);
        assertThat(reading.getFanSpeedPct()).isEqualTo(60.0);
        assertThat(reading.getMode()).isEqualTo(HvacMode.COOLING);
        assertThat(reading.getFaultType()).isEqualTo("none");
    }

    @Test
    void load_blankAndMalformedCellsBecomeAbsent() throws Exception {
        String csv = HEADER
                + "2024-01-01T00:00:00Z,Z1,AHU1,,22.0,45,14,23,n/a,60,,\n";

        Reading reading = loader.load(new StringReader(csv)).get(0);

        assertThat(reading.getTemperatureC()).isNull();
        assertThat(reading.getPowerKw()).isNull();
        assertThat(reading.getMode()).isNull();
        assertThat(reading.getFaultType()).isNull();
        assertThat(reading.getSetpointC()).isEqualTo(22.0);
    }

    @Test
    void load_acceptsOffsetTimestamps() throws Exception {
        String csv = HEADER + "2024-01-01T01:00:00+01:00,Z1,AHU1,22,22,45,14,23,7,60,heating,none\n";

        Reading reading = loader.load(new StringReader(csv)).get(0);

        assertThat(reading.getTimestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(reading.getMode()).isEqualTo(HvacMode.HEATING);
    }

    @Test
    void load_rejectsUnparseableTimestamp() {
        String csv = HEADER + "yesterday,Z1,AHU1,22,22,45,14,23,7,60,cooling,none\n";

        assertThatThrownBy(() -> loader.load(new StringReader(csv)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("line 2");
    }

    @Test
    void load_readsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("hvac_raw.csv");
        Files.writeString(file, HEADER
                + "2024-01-01 00:00:00,Z1,AHU1,22,22,45,14,23,7,60,off,none\n"
                + "2024-01-01 00:05:00,Z1,AHU1,22,22,45,14,23,7,60,off,none\n");

        assertThat(loader.load(file)).hasSize(2);
    }

    @Test
    void sortWithinZones_ordersByZoneThenTime() {
        List<Reading> readings = List.of(
                baseReading("Z2", 1).build(),
                baseReading("Z1", 2).build(),
                baseReading("Z2", 0).build(),
                baseReading("Z1", 0).build());

        List<Reading> sorted = ReadingCsvLoader.sortWithinZones(readings);

        assertThat(sorted).extracting(Reading::getZoneId).containsExactly("Z1", "Z1", "Z2", "Z2");
        assertThat(sorted).extracting(Reading::getTimestamp).containsExactly(at(0), at(2), at(0), at(1));
    }
}
