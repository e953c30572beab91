package com.findex.backend.service.aws;

import com.findex.backend.model.Detector;
import com.findex.backend.model.Finding;
import com.findex.backend.model.Region;
import com.findex.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.guardduty.model.GetFindingsRequest;
import software.amazon.awssdk.services.guardduty.model.GetFindingsResponse;
import software.amazon.awssdk.services.guardduty.model.ListDetectorsRequest;
import software.amazon.awssdk.services.guardduty.model.ListDetectorsResponse;
import software.amazon.awssdk.services.guardduty.model.ListFindingsRequest;
import software.amazon.awssdk.services.guardduty.model.ListFindingsResponse;

import java.util.List;

@Service
@RequiredArgsConstructor
public class AwsGuardDutyPort implements GuardDutyPort {

    private final AwsClientFactory clientFactory;
    private final AwsCallGuard callGuard;

    @Override
    public List<String> listDetectorIds(Region region, CancellationToken cancellation) {
        // GuardDuty allows one detector per account and region, so one page is enough.
        ListDetectorsResponse response = callGuard.call("ListDetectors", region.name(), cancellation,
                () -> clientFactory.guardDuty(region.name()).listDetectors(ListDetectorsRequest.builder().build()));
        return List.copyOf(response.detectorIds());
    }

    @Override
    public FindingIdSlice listFindingIds(Detector detector, String nextToken, int maxResults, CancellationToken cancellation) {
        String region = detector.region().name();
        ListFindingsRequest request = ListFindingsRequest.builder()
                .detectorId(detector.id())
                .maxResults(maxResults)
                .nextToken(nextToken)
                .build();
        ListFindingsResponse response = callGuard.call("ListFindings", region, cancellation,
                () -> clientFactory.guardDuty(region).listFindings(request));
        return new FindingIdSlice(List.copyOf(response.findingIds()), response.nextToken());
    }

    @Override
    public List<Finding> getFindings(Detector detector, List<String> findingIds, CancellationToken cancellation) {
        String region = detector.region().name();
        GetFindingsRequest request = GetFindingsRequest.builder()
                .detectorId(detector.id())
                .findingIds(findingIds)
                .build();
        GetFindingsResponse response = callGuard.call("GetFindings", region, cancellation,
                () -> clientFactory.guardDuty(region).getFindings(request));
        return response.findings().stream()
                .map(finding -> new Finding(
                        finding.id(),
                        finding.title(),
                        finding.description(),
                        finding.severity(),
                        finding.createdAt(),
                        finding.updatedAt()))
                .toList();
    }
}
