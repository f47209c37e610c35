package com.tradecopier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradeCopierApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeCopierApplication.class, args);
    }
}
