package com.queryforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QueryForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryForgeApplication.class, args);
    }
}
