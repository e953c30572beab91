package com.findex.backend.service.aws;

import com.findex.backend.util.CancellationToken;

import java.util.List;

/**
 * Source of region names, in the order the provider returns them.
 */
public interface RegionCatalog {

    List<String> describeRegions(CancellationToken cancellation);
}
