package com.transparency.assessment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TransparencyAssessmentApplication {
    public static void main(String[] args) {
        SpringApplication.run(TransparencyAssessmentApplication.class, args);
    }
}
