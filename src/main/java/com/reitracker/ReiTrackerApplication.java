package com.reitracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReiTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReiTrackerApplication.class, args);
    }
}
