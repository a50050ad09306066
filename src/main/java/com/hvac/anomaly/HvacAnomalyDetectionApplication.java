package com.hvac.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HvacAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(HvacAnomalyDetectionApplication.class, args);
    }
}
