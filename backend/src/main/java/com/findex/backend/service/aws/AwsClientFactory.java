package com.findex.backend.service.aws;

import com.findex.backend.config.AwsSettings;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.Ec2ClientBuilder;
import software.amazon.awssdk.services.guardduty.GuardDutyClient;
import software.amazon.awssdk.services.guardduty.GuardDutyClientBuilder;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds SDK clients from {@link AwsSettings}. One GuardDuty client per region,
 * created on first use. SDK retries are disabled and every call carries the
 * configured deadline.
 */
@Slf4j
@Component
public class AwsClientFactory {

    private final AwsSettings settings;
    private final AwsCredentialsProvider credentialsProvider;
    private final ClientOverrideConfiguration overrides;
    private final Map<String, GuardDutyClient> guardDutyClients = new ConcurrentHashMap<>();
    private volatile Ec2Client ec2Client;

    public AwsClientFactory(AwsSettings settings, AwsCredentialsProvider credentialsProvider) {
        this.settings = settings;
        this.credentialsProvider = credentialsProvider;
        this.overrides = ClientOverrideConfiguration.builder()
                .apiCallTimeout(settings.callTimeout())
                .retryPolicy(RetryPolicy.none())
                .build();
    }

    public Ec2Client discoveryClient() {
        Ec2Client client = ec2Client;
        if (client == null) {
            synchronized (this) {
                client = ec2Client;
                if (client == null) {
                    Ec2ClientBuilder builder = Ec2Client.builder()
                            .region(Region.of(settings.discoveryRegion()))
                            .credentialsProvider(credentialsProvider)
                            .overrideConfiguration(overrides);
                    if (settings.endpointOverride() != null) {
                        builder.endpointOverride(settings.endpointOverride());
                    }
                    client = builder.build();
                    ec2Client = client;
                }
            }
        }
        return client;
    }

    public GuardDutyClient guardDuty(String region) {
        return guardDutyClients.computeIfAbsent(region, name -> {
            log.debug("Creating GuardDuty client for region {}", name);
            GuardDutyClientBuilder builder = GuardDutyClient.builder()
                    .region(Region.of(name))
                    .credentialsProvider(credentialsProvider)
                    .overrideConfiguration(overrides);
            if (settings.endpointOverride() != null) {
                builder.endpointOverride(settings.endpointOverride());
            }
            return builder.build();
        });
    }

    @PreDestroy
    public void close() {
        guardDutyClients.values().forEach(GuardDutyClient::close);
        guardDutyClients.clear();
        if (ec2Client != null) {
            ec2Client.close();
        }
    }
}
