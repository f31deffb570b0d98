package com.chirm.chatapp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChirmApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChirmApplication.class, args);
    }
}
