package com.findex.backend.service;

import com.findex.backend.model.Detector;
import com.findex.backend.model.FindingPage;
import com.findex.backend.service.aws.GuardDutyPort;
import com.findex.backend.util.CancellationToken;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Single forward pass over the ListFindings pages of one detector. Every
 * {@link #next()} is exactly one remote call carrying the token returned by the
 * previous one; the cursor ends after the first page without a token. A failed
 * call ends the cursor and the error propagates.
 */
public final class FindingPageCursor implements Iterator<FindingPage> {

    private final GuardDutyPort guardDutyPort;
    private final Detector detector;
    private final int pageSize;
    private final CancellationToken cancellation;

    private String continuationToken;
    private int pagesFetched;
    private boolean exhausted;

    FindingPageCursor(GuardDutyPort guardDutyPort, Detector detector, int pageSize, CancellationToken cancellation) {
        this.guardDutyPort = guardDutyPort;
        this.detector = detector;
        this.pageSize = pageSize;
        this.cancellation = cancellation;
    }

    @Override
    public boolean hasNext() {
        return !exhausted;
    }

    @Override
    public FindingPage next() {
        if (exhausted) {
            throw new NoSuchElementException("No more finding pages for detector " + detector);
        }
        GuardDutyPort.FindingIdSlice slice;
        try {
            slice = guardDutyPort.listFindingIds(detector, continuationToken, pageSize, cancellation);
        } catch (RuntimeException e) {
            exhausted = true;
            throw e;
        }
        pagesFetched++;
        FindingPage page = new FindingPage(pagesFetched, slice.findingIds(), slice.nextToken());
        if (page.hasMore()) {
            continuationToken = page.nextToken();
        } else {
            continuationToken = null;
            exhausted = true;
        }
        return page;
    }

    public Detector detector() {
        return detector;
    }

    /** Token the next call will send; null before the first call and after the last page. */
    public String continuationToken() {
        return continuationToken;
    }

    public int pagesFetched() {
        return pagesFetched;
    }
}
