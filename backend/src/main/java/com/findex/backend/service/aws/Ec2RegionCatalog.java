package com.findex.backend.service.aws;

import com.findex.backend.config.AwsSettings;
import com.findex.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.ec2.model.DescribeRegionsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeRegionsResponse;

import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class Ec2RegionCatalog implements RegionCatalog {

    private final AwsClientFactory clientFactory;
    private final AwsCallGuard callGuard;
    private final AwsSettings settings;

    @Override
    public List<String> describeRegions(CancellationToken cancellation) {
        DescribeRegionsResponse response = callGuard.call("DescribeRegions", settings.discoveryRegion(), cancellation,
                () -> clientFactory.discoveryClient().describeRegions(DescribeRegionsRequest.builder().build()));
        return response.regions().stream()
                .map(software.amazon.awssdk.services.ec2.model.Region::regionName)
                .filter(Objects::nonNull)
                .toList();
    }
}
