package com.example.ocppcentral;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OcppCentralApplication {

    public static void main(String[] args) {
        SpringApplication.run(OcppCentralApplication.class, args);
    }
}
