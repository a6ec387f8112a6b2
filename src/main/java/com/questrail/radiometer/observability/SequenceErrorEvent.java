package com.questrail.radiometer.observability;

import java.time.Instant;

/**
 * Record representing a failed sequence file load.
 */
public record SequenceErrorEvent(
    Instant timestamp,
    String source,
    String message,
    Throwable cause
) {
}
