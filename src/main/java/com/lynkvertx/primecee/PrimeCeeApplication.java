package com.lynkvertx.primecee;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Prime CEE - energy-saving certificate valorisation engine
 * Main application entry point
 */
@SpringBootApplication
public class PrimeCeeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrimeCeeApplication.class, args);
    }
}
