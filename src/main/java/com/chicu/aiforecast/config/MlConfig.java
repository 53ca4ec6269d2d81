package com.chicu.aiforecast.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MlConfig {

    // все отметки времени (promotedAt, measuredAt, ...) — в UTC
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
