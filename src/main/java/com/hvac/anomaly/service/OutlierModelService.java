package com.hvac.anomaly.service;

import com.hvac.anomaly.config.MetricsConfig;
import com.hvac.anomaly.engine.isolationforest.OutlierModel;
import com.hvac.anomaly.engine.isolationforest.OutlierScorer;
import com.hvac.anomaly.feature.FeatureEngine;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Reading;
import com.hvac.anomaly.repository.OutlierModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class OutlierModelService {

    private static final Logger log = LoggerFactory.getLogger(OutlierModelService.class);

    private final FeatureEngine featureEngine;
    private final OutlierScorer outlierScorer;
    private final OutlierModelRepository modelRepository;
    private final MetricsConfig metricsConfig;

    public OutlierModelService(FeatureEngine featureEngine,
                               OutlierScorer outlierScorer,
                               OutlierModelRepository modelRepository,
                               MetricsConfig metricsConfig) {
        this.featureEngine = featureEngine;
        this.outlierScorer = outlierScorer;
        this.modelRepository = modelRepository;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Enrich the readings, fit a model on the fault-free ones and store it as the current model.
     *
     * @return metadata of the stored model
     * @throws com.hvac.anomaly.exception.ValidationException        on unsorted or duplicate readings
     * @throws com.hvac.anomaly.exception.InsufficientDataException  on too few fault-free records
     */
    public Map<String, Object> trainAndStore(List<Reading> readings) {
        log.info("Training outlier model from {} readings...", readings.size());

        List<EnrichedReading> enriched = featureEngine.enrich(readings);
        OutlierModel model = outlierScorer.train(enriched);
        modelRepository.save(model);
        metricsConfig.recordModelTrained(model.getTrainingSamples());

        return model.getMetadata();
    }

    /**
     * Metadata of the current model, or null if none has been trained.
     */
    public Map<String, Object> getCurrentModelMetadata() {
        return modelRepository.getModelMetadata();
    }
}
