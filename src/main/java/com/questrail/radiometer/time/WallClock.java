package com.questrail.radiometer.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to timestamp observability events.
 *
 * <p>Decoding never consults the clock; record timestamps come from the file.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
