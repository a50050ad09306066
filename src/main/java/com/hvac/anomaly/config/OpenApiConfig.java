package com.hvac.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI hvacAnomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("HVAC Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Batch anomaly detection for HVAC sensor data.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Submit a closed batch of readings via `POST /detection/run`\n" +
                                "2. Readings are split by zone and enriched with rolling statistics, lags and error terms\n" +
                                "3. Four stateful rules evaluate each zone's stream\n" +
                                "4. An Isolation Forest trained on fault-free records scores every reading\n" +
                                "5. Events from both detectors are unioned; per-zone failures are reported alongside\n\n" +
                                "**Detectors:**\n" +
                                "- `temp_drift` - zone temperature more than 3°C off setpoint for over 30 minutes\n" +
                                "- `clogged_filter` - fan speed and power both elevated for a sustained window\n" +
                                "- `compressor_failure` - sudden power drop in cooling mode while temperature rises\n" +
                                "- `oscillating_control` - more than 6 temperature error sign changes within an hour\n" +
                                "- `isolation_forest` - multi-dimensional outliers, 2% contamination threshold")
                        .contact(new Contact().name("Building Analytics Team")));
    }
}
