package com.example.image2excel.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the converter properties and the clock used to stamp generated workbooks.
 */
@Configuration
@EnableConfigurationProperties(ConverterProperties.class)
public class ConverterConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
