package com.tennis.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import com.tennis.tracker.config.TrackerProperties;

@SpringBootApplication
@EnableConfigurationProperties(TrackerProperties.class)
public class TennisTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TennisTrackerApplication.class, args);
    }
}
