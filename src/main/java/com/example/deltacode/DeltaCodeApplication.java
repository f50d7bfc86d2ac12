package com.example.deltacode;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeltaCodeApplication {
    public static void main(String[] args) {
        SpringApplication.run(DeltaCodeApplication.class, args);
    }
}
