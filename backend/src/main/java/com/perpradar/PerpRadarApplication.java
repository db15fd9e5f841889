package com.perpradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PerpRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(PerpRadarApplication.class, args);
    }
}
