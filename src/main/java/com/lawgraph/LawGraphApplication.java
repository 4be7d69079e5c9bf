package com.lawgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LawGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(LawGraphApplication.class, args);
    }
}
