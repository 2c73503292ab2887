package com.backtester;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BacktesterApplication {

    public static void main(String[] args) {
        SpringApplication.run(BacktesterApplication.class, args);
    }
}
