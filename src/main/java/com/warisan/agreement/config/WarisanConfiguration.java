package com.warisan.agreement.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(WarisanProperties.class)
public class WarisanConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
