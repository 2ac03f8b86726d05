package com.example.dococr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocOcrApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocOcrApplication.class, args);
    }
}
