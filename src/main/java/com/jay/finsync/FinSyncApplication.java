package com.jay.finsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(FinSyncApplication.class, args);
    }
}
