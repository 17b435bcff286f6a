package com.quantsim.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuantSimApplication {
    public static void main(String[] args) {
        SpringApplication.run(QuantSimApplication.class, args);
    }
}
