package com.example.reference_oracle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReferenceOracleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReferenceOracleApplication.class, args);
    }
}
