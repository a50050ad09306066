package com.hvac.anomaly.service;

import com.hvac.anomaly.config.MetricsConfig;
import com.hvac.anomaly.engine.isolationforest.OutlierModel;
import com.hvac.anomaly.engine.isolationforest.OutlierScorer;
import com.hvac.anomaly.exception.InsufficientDataException;
import com.hvac.anomaly.feature.FeatureEngine;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Reading;
import com.hvac.anomaly.repository.OutlierModelRepository;
import com.hvac.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutlierModelServiceTest {

    @Mock
    private FeatureEngine featureEngine;

    @Mock
    private OutlierScorer outlierScorer;

    @Mock
    private OutlierModelRepository modelRepository;

    @Mock
    private MetricsConfig metricsConfig;

    private OutlierModelService modelService;

    @BeforeEach
    void setUp() {
        modelService = new OutlierModelService(featureEngine, outlierScorer, modelRepository, metricsConfig);
    }

    @Test
    void trainAndStore_savesTrainedModel() {
        List<Reading> readings = TestDataFactory.steadyZone("Z1", 3);
        List<EnrichedReading> enriched = TestDataFactory.enrich(readings);
        OutlierModel model = OutlierModel.builder()
                .algorithm("isolation_forest")
                .featureNames(List.of("temp_zone_c"))
                .imputationValues(new double[]{22.5})
                .threshold(0.61)
                .contamination(0.02)
                .trainingSamples(3)
                .build();
        when(featureEngine.enrich(readings)).thenReturn(enriched);
        when(outlierScorer.train(enriched)).thenReturn(model);

        Map<String, Object> metadata = modelService.trainAndStore(readings);

        ArgumentCaptor<OutlierModel> saved = ArgumentCaptor.forClass(OutlierModel.class);
        verify(modelRepository).save(saved.capture());
        assertThat(saved.getValue()).isSameAs(model);
        verify(metricsConfig).recordModelTrained(3);
        assertThat(metadata).containsEntry("trainingSamples", 3).containsEntry("threshold", 0.61);
    }

    @Test
    void trainAndStore_insufficientDataStoresNothing() {
        List<Reading> readings = TestDataFactory.steadyZone("Z1", 3);
        when(featureEngine.enrich(readings)).thenReturn(List.of());
        when(outlierScorer.train(anyList())).thenThrow(new InsufficientDataException(0, 50));

        assertThatThrownBy(() -> modelService.trainAndStore(readings))
                .isInstanceOf(InsufficientDataException.class);

        verify(modelRepository, never()).save(any());
        verifyNoInteractions(metricsConfig);
    }

    @Test
    void getCurrentModelMetadata_delegatesToRepository() {
        when(modelRepository.getModelMetadata()).thenReturn(Map.of("algorithm", "isolation_forest"));

        assertThat(modelService.getCurrentModelMetadata()).containsEntry("algorithm", "isolation_forest");
    }
}
