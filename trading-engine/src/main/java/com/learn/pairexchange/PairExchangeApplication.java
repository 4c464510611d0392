package com.learn.pairexchange;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PairExchangeApplication {
    public static void main(String[] args) {
        SpringApplication.run(PairExchangeApplication.class, args);
    }
}
