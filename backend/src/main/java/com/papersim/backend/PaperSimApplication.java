package com.papersim.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaperSimApplication {
    public static void main(String[] args) {
        SpringApplication.run(PaperSimApplication.class, args);
    }
}
