package com.nextactiontracker.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Provides the clock every "now" in the ledger is read from.
 */
@Slf4j
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(NextActionTrackerProperties properties) {
        Clock clock = Clock.system(properties.resolveZone());
        log.info("Using clock zone {}", clock.getZone());
        return clock;
    }
}
