package com.fleetinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FleetInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetInsightApplication.class, args);
    }
}
