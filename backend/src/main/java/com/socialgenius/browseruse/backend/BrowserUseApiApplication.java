package com.socialgenius.browseruse.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BrowserUseApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrowserUseApiApplication.class, args);
    }
}
