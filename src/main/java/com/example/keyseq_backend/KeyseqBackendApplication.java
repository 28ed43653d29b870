package com.example.keyseq_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KeyseqBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeyseqBackendApplication.class, args);
    }
}
