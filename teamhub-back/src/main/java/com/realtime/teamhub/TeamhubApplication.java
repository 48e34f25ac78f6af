package com.realtime.teamhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TeamhubApplication {

    public static void main(String[] args) {
        SpringApplication.run(TeamhubApplication.class, args);
    }
}
