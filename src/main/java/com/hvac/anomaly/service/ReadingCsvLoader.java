package com.hvac.anomaly.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.hvac.anomaly.exception.ValidationException;
import com.hvac.anomaly.model.HvacMode;
import com.hvac.anomaly.model.Metric;
import com.hvac.anomaly.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Loads readings from a CSV export with the producer's column names
 * (timestamp, zone_id, ahu_id, temp_zone_c, ..., mode, fault_type).
 *
 * Empty or unparseable metric cells become absent values. Timestamps may be ISO-8601
 * instants/offsets or {@code yyyy-MM-dd HH:mm:ss}, the latter read as UTC.
 */
@Component
public class ReadingCsvLoader {

    private static final Logger log = LoggerFactory.getLogger(ReadingCsvLoader.class);

    private static final DateTimeFormatter LOCAL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private final CsvMapper csvMapper = new CsvMapper();

    public List<Reading> load(Path path) {
        try (Reader reader = Files.newBufferedReader(path)) {
            return load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    public List<Reading> load(Reader reader) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Reading> readings = new ArrayList<>();
        int malformedCells = 0;

        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(reader)) {
            int line = 1;
            while (rows.hasNext()) {
                line++;
                Map<String, String> row = rows.next();
                CellParser cells = new CellParser(row);
                readings.add(Reading.builder()
                        .timestamp(parseTimestamp(row.get("timestamp"), line))
                        .zoneId(blankToNull(row.get("zone_id")))
                        .ahuId(blankToNull(row.get("ahu_id")))
                        .temperatureC(cells.number(Metric.TEMPERATURE))
                        .setpointC(cells.number(Metric.SETPOINT))
                        .humidityPct(cells.number(Metric.HUMIDITY))
                        .supplyAirTempC(cells.number(Metric.SUPPLY_AIR_TEMP))
                        .returnAirTempC(cells.number(Metric.RETURN_AIR_TEMP))
                        .powerKw(cells.number(Metric.POWER))
                        .fanSpeedPct(cells.number(Metric.FAN_SPEED))
                        .mode(parseMode(row.get("mode")))
                        .faultType(blankToNull(row.get("fault_type")))
                        .build());
                malformedCells += cells.malformed;
            }
        }

        if (malformedCells > 0) {
            log.warn("Loaded {} readings; {} malformed metric cells carried as absent", readings.size(), malformedCells);
        } else {
            log.info("Loaded {} readings", readings.size());
        }
        return readings;
    }

    /**
     * Order readings by zone, then timestamp. Duplicates are kept so the feature engine can reject them.
     */
    public static List<Reading> sortWithinZones(List<Reading> readings) {
        List<Reading> sorted = new ArrayList<>(readings);
        sorted.sort(Comparator.comparing(Reading::getZoneId, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Reading::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder())));
        return sorted;
    }

    static Instant parseTimestamp(String value, int line) {
        String text = blankToNull(value);
        if (text == null) {
            throw new ValidationException("Missing timestamp on line " + line);
        }
        try {
            if (text.endsWith("Z")) return Instant.parse(text);
            if (text.length() > 19 && (text.contains("+") || text.lastIndexOf('-') > 9)) {
                return OffsetDateTime.parse(text).toInstant();
            }
            if (text.indexOf('T') > 0) return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            return LocalDateTime.parse(text, LOCAL_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Unparseable timestamp '" + text + "' on line " + line);
        }
    }

    private static HvacMode parseMode(String value) {
        try {
            return HvacMode.fromLabel(value);
        } catch (IllegalArgumentException e) {
            log.debug("Unknown mode '{}', carried as absent", value);
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static final class CellParser {
        private final Map<String, String> row;
        private int malformed;

        CellParser(Map<String, String> row) {
            this.row = row;
        }

        Double number(Metric metric) {
            String text = blankToNull(row.get(metric.getColumn()));
            if (text == null) return null;
            try {
                return Double.valueOf(text);
            } catch (NumberFormatException e) {
                malformed++;
                return null;
            }
        }
    }
}
