package com.jay.aurora;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuroraAnalyzerApplication {
    public static void main(String[] args) {
        SpringApplication.run(AuroraAnalyzerApplication.class, args);
    }
}
