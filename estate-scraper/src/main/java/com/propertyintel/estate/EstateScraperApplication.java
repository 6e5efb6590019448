package com.propertyintel.estate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class EstateScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(EstateScraperApplication.class, args);
    }
}
