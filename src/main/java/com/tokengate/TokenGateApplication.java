package com.tokengate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TokenGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenGateApplication.class, args);
    }
}
