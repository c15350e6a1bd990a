package com.example.paytracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaytrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaytrackerApplication.class, args);
    }
}
