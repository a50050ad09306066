package com.hvac.anomaly.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.hvac.anomaly.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes anomaly events as CSV for the downstream store.
 */
@Component
public class AnomalyCsvWriter {

    private static final Logger log = LoggerFactory.getLogger(AnomalyCsvWriter.class);

    private final ObjectWriter writer;

    public AnomalyCsvWriter() {
        CsvMapper csvMapper = new CsvMapper();
        CsvSchema schema = csvMapper.schemaFor(Row.class).withHeader();
        this.writer = csvMapper.writer(schema);
    }

    public void write(Path path, List<AnomalyEvent> events) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer out = Files.newBufferedWriter(path)) {
                write(out, events);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write anomalies to " + path, e);
        }
        log.info("Saved {} anomalies to {}", events.size(), path);
    }

    public void write(Writer out, List<AnomalyEvent> events) throws IOException {
        writer.writeValues(out).writeAll(events.stream().map(Row::of).toList()).close();
    }

    @JsonPropertyOrder({"timestamp", "zone_id", "ahu_id", "metric", "score", "rule_name", "severity", "fault_type_label"})
    record Row(@JsonProperty("timestamp") String timestamp,
               @JsonProperty("zone_id") String zoneId,
               @JsonProperty("ahu_id") String ahuId,
               @JsonProperty("metric") String metric,
               @JsonProperty("score") double score,
               @JsonProperty("rule_name") String ruleName,
               @JsonProperty("severity") String severity,
               @JsonProperty("fault_type_label") String faultTypeLabel) {

        static Row of(AnomalyEvent event) {
            return new Row(
                    event.getTimestamp().toString(),
                    event.getZoneId(),
                    event.getAhuId(),
                    event.getMetric(),
                    event.getScore(),
                    event.getRuleName().getRuleName(),
                    event.getSeverity().getLabel(),
                    event.getFaultTypeLabel());
        }
    }
}
