package com.example.chainstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainStreamApplication.class, args);
    }
}
