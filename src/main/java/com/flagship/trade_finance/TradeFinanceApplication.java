package com.flagship.trade_finance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TradeFinanceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeFinanceApplication.class, args);
    }
}
