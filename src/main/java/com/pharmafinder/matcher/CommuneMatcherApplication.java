package com.pharmafinder.matcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CommuneMatcherApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommuneMatcherApplication.class, args);
    }
}
