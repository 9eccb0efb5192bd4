package com.example.tradestore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class StoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
