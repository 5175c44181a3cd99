package com.gillianbc.forensicloss;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForensicLossApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForensicLossApplication.class, args);
    }
}
