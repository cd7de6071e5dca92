package com.tutorhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TutorHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutorHubApplication.class, args);
    }
}
