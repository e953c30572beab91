package com.findex.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "findex.aws")
@Data
public class AwsProperties {

    /** Region used for the EC2 DescribeRegions call. */
    private String discoveryRegion = "us-east-1";

    /** Optional endpoint for every client, e.g. a local stub. */
    private String endpointOverride;

    private long callTimeoutMs = 30_000;

    private RateLimit rateLimit = new RateLimit();

    @Data
    public static class RateLimit {
        private int limitPerSecond = 10;
        private long timeoutMs = 5_000;
    }

    public AwsSettings toSettings() {
        return new AwsSettings(
                discoveryRegion,
                endpointOverride == null || endpointOverride.isBlank() ? null : URI.create(endpointOverride),
                Duration.ofMillis(callTimeoutMs),
                rateLimit.getLimitPerSecond(),
                Duration.ofMillis(rateLimit.getTimeoutMs()));
    }
}
