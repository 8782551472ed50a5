package com.di.silverline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Bronze to silver ingestion service. Runs are triggered over HTTP ({@code /api/ingestion/runs})
 * by an external scheduler.
 */
@SpringBootApplication
public class SilverlineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SilverlineApplication.class, args);
    }
}
