package com.edge.bench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdgeBenchApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgeBenchApplication.class, args);
    }
}
