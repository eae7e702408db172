package com.familyledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** Source of every entity timestamp and revision time. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
