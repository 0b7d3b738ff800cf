package com.memstack.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MemStackIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemStackIngestApplication.class, args);
    }
}
