package com.discusscall.core;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiscussCallApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiscussCallApplication.class, args);
    }
}
