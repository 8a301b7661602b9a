package com.frauddetection.hypersearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Hyperparameter Search service.
 * Hosts independent random searches that drive an external training service.
 */
@SpringBootApplication
public class HyperparameterSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(HyperparameterSearchApplication.class, args);
    }

}
