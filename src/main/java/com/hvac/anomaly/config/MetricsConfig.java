package com.hvac.anomaly.config;

import com.hvac.anomaly.model.DetectorType;
import com.hvac.anomaly.model.FailureStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(int zoneCount, long elapsedMillis) {
        Counter.builder("detection.run.count")
                .register(registry)
                .increment();

        Counter.builder("detection.zones.count")
                .register(registry)
                .increment(zoneCount);

        Timer.builder("detection.run.duration")
                .register(registry)
                .record(elapsedMillis, TimeUnit.MILLISECONDS);
    }

    public void recordEvents(DetectorType detector, int count) {
        Counter.builder("detection.events.count")
                .tag("detector", detector.getRuleName())
                .register(registry)
                .increment(count);
    }

    public void recordFailure(FailureStage stage) {
        Counter.builder("detection.failures.count")
                .tag("stage", stage.name())
                .register(registry)
                .increment();
    }

    public void recordModelTrained(int trainingSamples) {
        Counter.builder("detection.model.trained.count")
                .register(registry)
                .increment();

        registry.summary("detection.model.training_samples").record(trainingSamples);
    }
}
