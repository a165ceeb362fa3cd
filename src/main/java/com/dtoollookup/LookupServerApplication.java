package com.dtoollookup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LookupServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LookupServerApplication.class, args);
    }
}
