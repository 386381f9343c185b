package com.numaansystems.bridge.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class BridgeConfig {

    /**
     * Time source for session ages. Tests replace it with a fixed or mutable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
