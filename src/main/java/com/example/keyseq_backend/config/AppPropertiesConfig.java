package com.example.keyseq_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({SequenceSearchProperties.class, SimilarityProperties.class})
public class AppPropertiesConfig {

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }
}
