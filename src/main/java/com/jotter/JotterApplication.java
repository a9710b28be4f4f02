package com.jotter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JotterApplication {

    public static void main(String[] args) {
        SpringApplication.run(JotterApplication.class, args);
    }
}
