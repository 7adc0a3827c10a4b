package com.lynkvertx.evfeas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * EVFEAS - EV Charger Feasibility Engine
 * Main application entry point
 */
@SpringBootApplication
public class EvFeasibilityApplication {

    public static void main(String[] args) {
        SpringApplication.run(EvFeasibilityApplication.class, args);
    }
}
