package com.scorestats.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ScoreStatisticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScoreStatisticsApplication.class, args);
    }
}
