package com.insightpulse.kgengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KgEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(KgEngineApplication.class, args);
    }
}
