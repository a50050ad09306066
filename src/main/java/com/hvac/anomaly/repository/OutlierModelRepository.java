package com.hvac.anomaly.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hvac.anomaly.config.DetectionConfig;
import com.hvac.anomaly.engine.isolationforest.OutlierModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Stores the fitted outlier model as a self-contained JSON artifact so that score-only
 * runs can use it without the training data.
 */
@Repository
public class OutlierModelRepository {

    private static final Logger log = LoggerFactory.getLogger(OutlierModelRepository.class);

    private final Path modelPath;
    private final ObjectMapper objectMapper;

    // In-memory copy of the current model
    private final AtomicReference<OutlierModel> cached = new AtomicReference<>();

    @Autowired
    public OutlierModelRepository(DetectionConfig config) {
        this(Paths.get(config.getOutlier().getModelPath()));
    }

    public OutlierModelRepository(Path modelPath) {
        this.modelPath = modelPath;
        this.objectMapper = new ObjectMapper();
    }

    public void save(OutlierModel model) {
        try {
            Path parent = modelPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = modelPath.resolveSibling(modelPath.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), model);
            Files.move(tmp, modelPath, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save outlier model to " + modelPath, e);
        }

        cached.set(model);
        log.info("Saved {} model to {}: {} samples", model.getAlgorithm(), modelPath, model.getTrainingSamples());
    }

    /**
     * The current model, or null if none has been saved.
     */
    public OutlierModel load() {
        OutlierModel model = cached.get();
        if (model != null) return model;
        if (!Files.exists(modelPath)) return null;

        try {
            model = objectMapper.readValue(modelPath.toFile(), OutlierModel.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load outlier model from " + modelPath, e);
        }
        cached.compareAndSet(null, model);
        log.info("Loaded {} model from {}", model.getAlgorithm(), modelPath);
        return cached.get();
    }

    public Map<String, Object> getModelMetadata() {
        OutlierModel model = load();
        return model == null ? null : model.getMetadata();
    }

    public Path getModelPath() {
        return modelPath;
    }

    public void clearCache() {
        cached.set(null);
    }
}
