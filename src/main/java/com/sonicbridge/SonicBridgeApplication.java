package com.sonicbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Firewall event normalization and retrieval service for SonicOS 7.x and 8.x appliances.
 */
@SpringBootApplication
@EnableScheduling
public class SonicBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SonicBridgeApplication.class, args);
    }
}
