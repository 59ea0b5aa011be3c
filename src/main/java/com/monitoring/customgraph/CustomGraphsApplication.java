package com.monitoring.customgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CustomGraphsApplication {
    public static void main(String[] args) {
        SpringApplication.run(CustomGraphsApplication.class, args);
    }
}
