package com.testflow.testflow_runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TestflowRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TestflowRunnerApplication.class, args);
    }
}
