package com.clinicflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ClinicFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinicFlowApplication.class, args);
    }
}
