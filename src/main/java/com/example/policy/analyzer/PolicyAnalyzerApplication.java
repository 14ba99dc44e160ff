package com.example.policy.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@Slf4j
public class PolicyAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicyAnalyzerApplication.class, args);
        log.info("PolicyAnalyzerApplication started successfully.");
    }

}
