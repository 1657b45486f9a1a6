package com.capacityengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Capacity Engine.
 *
 * Capacity Engine allocates throughput subscriptions, either by auction or by locking
 * assets, and lets subscription holders run operations without paying the normal fee
 * as long as their continuously accruing quota covers the cost.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CapacityEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CapacityEngineApplication.class, args);
    }
}
