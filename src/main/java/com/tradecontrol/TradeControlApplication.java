package com.tradecontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TradeControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeControlApplication.class, args);
    }
}
