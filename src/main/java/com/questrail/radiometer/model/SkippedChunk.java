package com.questrail.radiometer.model;

import java.util.Objects;

/**
 * A chunk that was split correctly but whose record could not be decoded and
 * was dropped under the skip policy.
 *
 * @param index  zero-based chunk index within the file
 * @param offset byte offset of the chunk within the file
 * @param length declared chunk length, including the length field
 * @param reason decode failure message
 */
public record SkippedChunk(int index, int offset, int length, String reason)
{
    public SkippedChunk {
        Objects.requireNonNull(reason, "reason");
    }
}
