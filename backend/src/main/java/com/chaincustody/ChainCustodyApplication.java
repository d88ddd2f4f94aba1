package com.chaincustody;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainCustodyApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainCustodyApplication.class, args);
    }
}
