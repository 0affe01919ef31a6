package com.goormthonuniv.factmerge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FactMergeApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactMergeApplication.class, args);
    }
}
