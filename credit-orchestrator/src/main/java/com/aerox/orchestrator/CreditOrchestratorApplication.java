package com.aerox.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Credit decision service: scores a booking, gates it green / yellow / red, generates
 * budget-clearing alternatives for the yellow band and runs bounded negotiations over them.
 */
@SpringBootApplication
public class CreditOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditOrchestratorApplication.class, args);
    }
}
