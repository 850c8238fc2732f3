package com.registry.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Main application entry point for the Entity Registry.
 */
@SpringBootApplication
@ComponentScan(basePackages = {
    "com.registry.api",
    "com.registry.engine"
})
public class EntityRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(EntityRegistryApplication.class, args);
    }
}
