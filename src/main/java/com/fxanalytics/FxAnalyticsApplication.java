package com.fxanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FxAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FxAnalyticsApplication.class, args);
    }
}
