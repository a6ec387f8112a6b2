package com.questrail.radiometer.calibration;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * X-axis for plotting a spectrum: calibrated wavelengths, or raw pixel indices
 * when no calibration exists for the record's channel.
 */
public sealed interface SpectralAxis
        permits SpectralAxis.WavelengthAxis, SpectralAxis.PixelAxis
{
    /**
     * Returns one axis value per pixel.
     */
    double[] values();

    int length();

    /**
     * Human-readable axis label including the unit.
     */
    String label();

    /**
     * Wavelengths in nanometers, one per pixel.
     */
    final class WavelengthAxis implements SpectralAxis
    {
        private final double[] nanometers;

        public WavelengthAxis(double[] nanometers) {
            this.nanometers = nanometers.clone();
        }

        @Override
        public double[] values() {
            return nanometers.clone();
        }

        @Override
        public int length() {
            return nanometers.length;
        }

        @Override
        public String label() {
            return "Wavelength [nm]";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof WavelengthAxis that)) return false;
            return Arrays.equals(nanometers, that.nanometers);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(nanometers);
        }

        @Override
        public String toString() {
            return "WavelengthAxis[length=" + nanometers.length + ']';
        }
    }

    /**
     * Zero-based pixel indices.
     */
    record PixelAxis(int length) implements SpectralAxis
    {
        public PixelAxis {
            if (length < 0) {
                throw new IllegalArgumentException("length must be >= 0 (was " + length + ")");
            }
        }

        @Override
        public double[] values() {
            return IntStream.range(0, length).asDoubleStream().toArray();
        }

        @Override
        public String label() {
            return "Pixel number";
        }
    }
}
