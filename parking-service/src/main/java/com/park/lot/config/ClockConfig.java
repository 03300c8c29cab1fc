package com.park.lot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** Wall clock used for entry/exit timestamps and billing. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
