package com.disasterfeed.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class DisasterSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(DisasterSyncApplication.class, args);
    }
}
