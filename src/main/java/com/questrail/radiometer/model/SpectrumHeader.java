package com.questrail.radiometer.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Fixed header of a spectral measurement.
 *
 * @param timestamp    acquisition time, milliseconds since the Unix epoch
 * @param spectrumType radiometer channel and entrance optics
 * @param exposureTime exposure duration in milliseconds (unsigned 32-bit)
 * @param pixelCount   number of samples in the body (unsigned 16-bit)
 * @param temperature  sensor temperature in degrees Celsius
 * @param accelStats   raw accelerometer statistics
 */
public record SpectrumHeader(
        long timestamp,
        SpectrumType spectrumType,
        long exposureTime,
        int pixelCount,
        float temperature,
        AccelStats accelStats
)
{
    public static final int MAX_PIXEL_COUNT = 0xFFFF;
    public static final long MAX_EXPOSURE_TIME = 0xFFFF_FFFFL;

    public SpectrumHeader {
        Objects.requireNonNull(spectrumType, "spectrumType");
        Objects.requireNonNull(accelStats, "accelStats");
        if (pixelCount < 0 || pixelCount > MAX_PIXEL_COUNT) {
            throw new IllegalArgumentException(
                    "pixelCount must be in range 0–" + MAX_PIXEL_COUNT + " (was " + pixelCount + ")");
        }
        if (exposureTime < 0 || exposureTime > MAX_EXPOSURE_TIME) {
            throw new IllegalArgumentException(
                    "exposureTime must be in range 0–" + MAX_EXPOSURE_TIME + " (was " + exposureTime + ")");
        }
    }

    /**
     * Returns the acquisition time as an {@link Instant}.
     */
    public Instant acquiredAt() {
        return Instant.ofEpochMilli(timestamp);
    }
}
