package com.automotiveiot.eventderiver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Ingestion gateway for the dashcam's sensor uploads. Raw readings arrive on the
 * {@code deriveSensorEvents-in-0} binding; derivation units leave on
 * {@code deriveSensorEvents-out-0} and rejected readings on {@code sensorRejects-out-0}.
 */
@SpringBootApplication
public class EventDeriverApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventDeriverApplication.class, args);
    }
}
