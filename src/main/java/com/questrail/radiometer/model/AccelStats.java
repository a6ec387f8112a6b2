package com.questrail.radiometer.model;

/**
 * Accelerometer statistics recorded during an acquisition.
 *
 * <p>All six values are raw signed 16-bit readings. The sensor full scale is
 * {@value #FULL_SCALE_G} g over {@value #FULL_SCALE_RAW} counts; use
 * {@link #toG(int)} or the {@code *G()} accessors to convert.</p>
 */
public record AccelStats(
        short meanX,
        short meanY,
        short meanZ,
        short stdX,
        short stdY,
        short stdZ
)
{
    public static final double FULL_SCALE_G = 19.6;
    public static final double FULL_SCALE_RAW = 32768.0;

    public static final AccelStats ZERO = new AccelStats((short) 0, (short) 0, (short) 0,
            (short) 0, (short) 0, (short) 0);

    /**
     * Converts a raw accelerometer reading to g.
     */
    public static double toG(int raw) {
        return raw * FULL_SCALE_G / FULL_SCALE_RAW;
    }

    public double meanXG() {
        return toG(meanX);
    }

    public double meanYG() {
        return toG(meanY);
    }

    public double meanZG() {
        return toG(meanZ);
    }

    public double stdXG() {
        return toG(stdX);
    }

    public double stdYG() {
        return toG(stdY);
    }

    public double stdZG() {
        return toG(stdZ);
    }
}
