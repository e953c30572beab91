package com.findex.backend.service;

import com.findex.backend.model.Detector;
import com.findex.backend.model.Finding;
import com.findex.backend.service.aws.GuardDutyPort;
import com.findex.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FindingBatchResolver {

    private final GuardDutyPort guardDutyPort;

    /**
     * Fetches full records for one page of ids in a single GetFindings call.
     * An empty page makes no call. The result may omit ids the service could
     * not resolve and is used as returned.
     */
    public List<Finding> resolve(Detector detector, List<String> findingIds, CancellationToken cancellation) {
        if (findingIds == null || findingIds.isEmpty()) {
            return List.of();
        }
        List<Finding> findings = guardDutyPort.getFindings(detector, findingIds, cancellation);
        if (findings.size() != findingIds.size()) {
            log.debug("GetFindings for {} returned {} of {} requested findings",
                    detector, findings.size(), findingIds.size());
        }
        return findings;
    }
}
