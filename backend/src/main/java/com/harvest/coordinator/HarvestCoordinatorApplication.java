package com.harvest.coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class HarvestCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(HarvestCoordinatorApplication.class, args);
    }
}
