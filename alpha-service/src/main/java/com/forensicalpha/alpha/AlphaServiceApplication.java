package com.forensicalpha.alpha;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlphaServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlphaServiceApplication.class, args);
    }
}
