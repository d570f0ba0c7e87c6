package com.oracle.thinking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SequentialThinkingApplication {

    public static void main(String[] args) {
        SpringApplication.run(SequentialThinkingApplication.class, args);
    }
}
