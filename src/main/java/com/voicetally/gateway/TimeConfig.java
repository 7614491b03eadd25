package com.voicetally.gateway;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single source of "now" for the tracker; everything below takes instants from it.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock appClock() {
        return Clock.systemUTC();
    }
}
