package com.demographics.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DemographicAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(DemographicAnomalyApplication.class, args);
    }
}
