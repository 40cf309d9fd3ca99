package com.brigade.vacuum.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class VacuumConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
