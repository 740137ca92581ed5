package com.switchyard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans for the engine.
 */
@Configuration
public class EngineConfig {

    /** Injected wherever freshness or timestamps are computed so tests can control time. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
