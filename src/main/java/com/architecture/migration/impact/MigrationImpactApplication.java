package com.architecture.migration.impact;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MigrationImpactApplication {

    public static void main(String[] args) {
        SpringApplication.run(MigrationImpactApplication.class, args);
    }
}
