package com.findex.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SettingsConfig {

    @Bean
    public AwsSettings awsSettings(AwsProperties properties) {
        return properties.toSettings();
    }

    @Bean
    public ExportSettings exportSettings(ExportProperties properties) {
        return properties.toSettings();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
