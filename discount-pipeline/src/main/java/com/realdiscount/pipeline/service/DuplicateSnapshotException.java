package com.realdiscount.pipeline.service;

import java.time.Instant;

/**
 * A snapshot already exists for the same raw product and scrape timestamp. Benign: the caller
 * skips the observation instead of failing.
 */
public class DuplicateSnapshotException extends RuntimeException {

    private final long rawProductId;
    private final Instant scrapedAt;

    public DuplicateSnapshotException(long rawProductId, Instant scrapedAt) {
        super("Snapshot already recorded for raw product " + rawProductId + " at " + scrapedAt);
        this.rawProductId = rawProductId;
        this.scrapedAt = scrapedAt;
    }

    public long getRawProductId() {
        return rawProductId;
    }

    public Instant getScrapedAt() {
        return scrapedAt;
    }
}
