package com.chicu.croprecommender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.croprecommender")
public class CropRecommenderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CropRecommenderApplication.class, args);
    }
}
