package com.schedbot.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * schedbot application entry point.
 */
@SpringBootApplication
@EnableScheduling
public class SchedbotApplication {

    public static void main(String[] args) {
        SpringApplication.run(SchedbotApplication.class, args);
    }
}
