package com.questrail.radiometer.observability;

import java.time.Instant;

/**
 * Record describing a completed sequence file load.
 */
public record SequenceLoadedEvent(
    Instant timestamp,
    String source,
    int chunkCount,
    int recordCount,
    int skippedCount
) {
}
