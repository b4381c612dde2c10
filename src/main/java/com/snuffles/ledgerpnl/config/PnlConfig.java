package com.snuffles.ledgerpnl.config;

import com.snuffles.ledgerpnl.service.InstrumentResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PnlConfig {

    @Bean
    public InstrumentResolver instrumentResolver(InstrumentProperties properties) {
        return new InstrumentResolver(properties.multipliers(), properties.aliases());
    }
}
