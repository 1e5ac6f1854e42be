package com.axiomprofiler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AxiomProfilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AxiomProfilerApplication.class, args);
    }
}
