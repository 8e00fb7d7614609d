package com.goldtrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GoldTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(GoldTraderApplication.class, args);
    }
}
