package com.example.rittdoc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RittDocConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(RittDocConverterApplication.class, args);
    }
}
