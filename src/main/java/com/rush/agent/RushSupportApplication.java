package com.rush.agent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RushSupportApplication {

    public static void main(String[] args) {
        SpringApplication.run(RushSupportApplication.class, args);
    }
}
