package com.hvac.anomaly.exception;

import lombok.Getter;

@Getter
public class InsufficientDataException extends DetectionException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super(String.format("Outlier model needs at least %d fault-free records, got %d", required, available));
        this.available = available;
        this.required = required;
    }
}
