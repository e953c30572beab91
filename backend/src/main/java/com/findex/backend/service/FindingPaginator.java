package com.findex.backend.service;

import com.findex.backend.config.ExportSettings;
import com.findex.backend.model.Detector;
import com.findex.backend.service.aws.GuardDutyPort;
import com.findex.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FindingPaginator {

    private final GuardDutyPort guardDutyPort;
    private final ExportSettings exportSettings;

    /**
     * A fresh cursor over the detector's finding ids. No call is made until the
     * first page is requested.
     */
    public FindingPageCursor pages(Detector detector, CancellationToken cancellation) {
        return new FindingPageCursor(guardDutyPort, detector, exportSettings.pageSize(), cancellation);
    }
}
