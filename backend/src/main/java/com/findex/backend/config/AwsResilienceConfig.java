package com.findex.backend.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class AwsResilienceConfig {

    /**
     * Client-side throttle shared by every EC2 and GuardDuty call. There is no
     * retry or circuit breaker: a rejected permit fails the call.
     */
    @Bean
    public RateLimiter awsRateLimiter(AwsSettings settings) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(settings.rateLimitPerSecond())
                .timeoutDuration(settings.rateLimitTimeout())
                .build();
        return RateLimiter.of("aws", config);
    }
}
