package com.eainde.salary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SalaryEstimatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalaryEstimatorApplication.class, args);
    }
}
