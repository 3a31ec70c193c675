package com.macro.liquidity.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI liquidityAnalyticsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Liquidity Analytics API")
                        .version("1.0.0")
                        .description(
                                "Batch analytics over central-bank, money-market and fiscal time series.\n\n" +
                                "**Analysis Pipeline:**\n" +
                                "1. Submit raw series via `POST /api/v1/liquidity/analysis`\n" +
                                "2. Align series onto one date axis with frequency-aware gap filling\n" +
                                "3. Derive net liquidity, spreads, multi-horizon changes and policy stance\n" +
                                "4. Summarize month-to-date, quarter-to-date and rolling 3-month windows\n" +
                                "5. Detect spread spikes, score money-market stress (0-100) and vote the regime\n" +
                                "6. Build the fiscal / monetary / plumbing composite index\n\n" +
                                "**Stress Levels:** LOW (<25), MODERATE (25-50), ELEVATED (50-75), HIGH_STRESS (>=75)\n\n" +
                                "**Composite Bands:** Very Tight (<=-1), Tight (<=-0.5), Neutral (<=0.5), Easy (<=1), Very Easy")
                        .contact(new Contact().name("Liquidity Analytics Team")));
    }
}
