package com.findex.backend.service;

import com.findex.backend.config.ExportSettings;
import com.findex.backend.model.Region;
import com.findex.backend.service.aws.RegionCatalog;
import com.findex.backend.util.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RegionResolver {

    private final RegionCatalog regionCatalog;
    private final ExportSettings exportSettings;

    public List<Region> listRegions() {
        return listRegions(exportSettings.regionPrefix(), CancellationToken.none());
    }

    /**
     * One DescribeRegions call, filtered by name prefix. Provider order is kept
     * and failures propagate unchanged.
     */
    public List<Region> listRegions(String prefix, CancellationToken cancellation) {
        String filter = prefix == null ? "" : prefix;
        List<Region> regions = regionCatalog.describeRegions(cancellation).stream()
                .filter(name -> name.startsWith(filter))
                .map(Region::new)
                .toList();
        log.info("Resolved {} regions matching prefix '{}'", regions.size(), filter);
        return regions;
    }
}
