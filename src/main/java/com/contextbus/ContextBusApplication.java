package com.contextbus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ContextBusApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContextBusApplication.class, args);
    }
}
