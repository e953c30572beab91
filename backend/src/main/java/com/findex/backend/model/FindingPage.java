package com.findex.backend.model;

import java.util.List;

/**
 * One page of finding identifiers as returned by ListFindings.
 * A blank {@code nextToken} marks the last page of a detector.
 */
public record FindingPage(int pageNumber, List<String> findingIds, String nextToken) {

    public FindingPage {
        findingIds = findingIds == null ? List.of() : List.copyOf(findingIds);
    }

    public boolean isEmpty() {
        return findingIds.isEmpty();
    }

    public boolean hasMore() {
        return nextToken != null && !nextToken.isBlank();
    }

    public int size() {
        return findingIds.size();
    }
}
