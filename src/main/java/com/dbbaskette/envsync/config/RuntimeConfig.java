package com.dbbaskette.envsync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RuntimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
