package com.fxplatform.ingestion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RateIngestionApplication {

    public static void main(String[] args) {
        SpringApplication.run(RateIngestionApplication.class, args);
    }
}
