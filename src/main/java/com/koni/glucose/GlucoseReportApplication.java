package com.koni.glucose;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GlucoseReportApplication {

    public static void main(String[] args) {
        SpringApplication.run(GlucoseReportApplication.class, args);
    }
}
