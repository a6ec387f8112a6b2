package com.questrail.radiometer.codec.impl;

import com.questrail.radiometer.codec.ChunkSplitter;

/**
 * SpectrumWireLayout
 * -----------------------------------------------------------------------------
 * Byte offsets of the spectrum chunk layout, relative to the start of the chunk
 * (the first length-prefix byte).
 *
 * <pre>
 *   0   u16  chunk length (incl. this field)
 *   2   i64  timestamp, ms since epoch
 *   10  u8   radiometer code
 *   11  u8   optics code
 *   12  u32  exposure time, ms
 *   16  u16  pixel count
 *   18  f32  temperature, °C
 *   22  6×i16 accel mean x,y,z / std x,y,z
 *   34  6    reserved
 *   40  pixelCount × u16 samples
 * </pre>
 *
 * <p>All multi-byte fields are little-endian.</p>
 */
final class SpectrumWireLayout
{
    static final int TIMESTAMP_OFFSET = ChunkSplitter.LENGTH_FIELD_SIZE;
    static final int RADIOMETER_OFFSET = 10;
    static final int OPTICS_OFFSET = 11;
    static final int EXPOSURE_OFFSET = 12;
    static final int PIXEL_COUNT_OFFSET = 16;
    static final int TEMPERATURE_OFFSET = 18;
    static final int ACCEL_OFFSET = 22;
    static final int RESERVED_OFFSET = 34;
    static final int RESERVED_SIZE = 6;

    /** Fixed header size, length prefix included. */
    static final int HEADER_SIZE = RESERVED_OFFSET + RESERVED_SIZE;

    static final int SAMPLE_SIZE = 2;

    /** Largest chunk the 16-bit length prefix can describe. */
    static final int MAX_CHUNK_LENGTH = 0xFFFF;

    /** Largest pixel count that still fits in {@link #MAX_CHUNK_LENGTH}. */
    static final int MAX_PIXEL_COUNT = (MAX_CHUNK_LENGTH - HEADER_SIZE) / SAMPLE_SIZE;

    /** Largest value an enum code byte can carry. */
    static final int MAX_CODE = 0xFF;

    private SpectrumWireLayout() {}

    /**
     * Returns the exact chunk length for a record of {@code pixelCount} samples.
     */
    static int chunkLength(int pixelCount) {
        return HEADER_SIZE + pixelCount * SAMPLE_SIZE;
    }
}
