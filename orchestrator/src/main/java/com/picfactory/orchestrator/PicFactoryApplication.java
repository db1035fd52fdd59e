package com.picfactory.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PicFactoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(PicFactoryApplication.class, args);
    }
}
