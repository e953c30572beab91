package com.findex.backend.service.aws;

import com.findex.backend.model.Detector;
import com.findex.backend.model.Finding;
import com.findex.backend.model.Region;
import com.findex.backend.util.CancellationToken;

import java.util.List;

/**
 * The three GuardDuty operations the export needs. Each method is exactly one
 * remote call.
 */
public interface GuardDutyPort {

    List<String> listDetectorIds(Region region, CancellationToken cancellation);

    FindingIdSlice listFindingIds(Detector detector, String nextToken, int maxResults, CancellationToken cancellation);

    List<Finding> getFindings(Detector detector, List<String> findingIds, CancellationToken cancellation);

    record FindingIdSlice(List<String> findingIds, String nextToken) {}
}
