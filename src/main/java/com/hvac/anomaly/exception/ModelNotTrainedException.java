package com.hvac.anomaly.exception;

public class ModelNotTrainedException extends DetectionException {

    public ModelNotTrainedException() {
        super("Outlier model must be trained or loaded before scoring");
    }
}
