package com.questrail.radiometer.config;

/**
 * What the sequence reader does when a chunk splits correctly but its record
 * cannot be decoded.
 *
 * <p>Chunk-splitting errors always abort the whole file regardless of policy.</p>
 */
public enum BadRecordPolicy
{
    /** Abort the load; the caller receives no records. */
    FAIL_FAST,

    /** Drop the record, note it as skipped, and continue with the next chunk. */
    SKIP
}
