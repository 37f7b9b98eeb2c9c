package com.pairstream.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PairStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(PairStreamApplication.class, args);
    }
}
