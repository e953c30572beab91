package com.findex.backend.config;

import java.net.URI;
import java.time.Duration;

/**
 * Immutable AWS client settings, built once from {@link AwsProperties}.
 */
public record AwsSettings(
        String discoveryRegion,
        URI endpointOverride,
        Duration callTimeout,
        int rateLimitPerSecond,
        Duration rateLimitTimeout
) {

    public AwsSettings {
        if (discoveryRegion == null || discoveryRegion.isBlank()) {
            throw new IllegalArgumentException("findex.aws.discovery-region must be set");
        }
        if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("findex.aws.call-timeout-ms must be positive");
        }
        if (rateLimitPerSecond <= 0) {
            throw new IllegalArgumentException("findex.aws.rate-limit.limit-per-second must be positive");
        }
    }
}
