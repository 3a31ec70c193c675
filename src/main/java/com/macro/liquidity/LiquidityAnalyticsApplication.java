package com.macro.liquidity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiquidityAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiquidityAnalyticsApplication.class, args);
    }
}
