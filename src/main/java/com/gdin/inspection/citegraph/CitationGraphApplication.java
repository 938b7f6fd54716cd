package com.gdin.inspection.citegraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CitationGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(CitationGraphApplication.class, args);
    }
}
