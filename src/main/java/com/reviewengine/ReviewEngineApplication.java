package com.reviewengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReviewEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReviewEngineApplication.class, args);
    }
}
