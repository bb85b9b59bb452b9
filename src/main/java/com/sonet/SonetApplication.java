package com.sonet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SonetApplication {

    public static void main(String[] args) {
        SpringApplication.run(SonetApplication.class, args);
    }
}
