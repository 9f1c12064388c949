package com.fundengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FundEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(FundEngineApplication.class, args);
    }
}
