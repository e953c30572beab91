package com.findex.backend.service;

import com.findex.backend.model.Detector;
import com.findex.backend.model.Region;
import com.findex.backend.service.aws.GuardDutyPort;
import com.findex.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class DetectorEnumerator {

    private final GuardDutyPort guardDutyPort;

    /**
     * Lists the detectors of one region. An empty list is a valid answer.
     */
    public List<Detector> listDetectors(Region region, CancellationToken cancellation) {
        List<Detector> detectors = guardDutyPort.listDetectorIds(region, cancellation).stream()
                .map(id -> new Detector(region, id))
                .toList();
        log.info("Found {} detectors in region {}", detectors.size(), region);
        return detectors;
    }
}
