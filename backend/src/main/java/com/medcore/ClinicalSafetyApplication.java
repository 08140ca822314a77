package com.medcore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClinicalSafetyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinicalSafetyApplication.class, args);
    }
}
