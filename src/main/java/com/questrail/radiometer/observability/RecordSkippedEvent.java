package com.questrail.radiometer.observability;

import com.questrail.radiometer.codec.SequenceFormatException;
import com.questrail.radiometer.model.SkippedChunk;

import java.time.Instant;

/**
 * Record describing a chunk dropped under the skip policy.
 */
public record RecordSkippedEvent(
    Instant timestamp,
    String source,
    SkippedChunk chunk,
    SequenceFormatException cause
) {
}
