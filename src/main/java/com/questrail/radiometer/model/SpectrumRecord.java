package com.questrail.radiometer.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * SpectrumRecord
 * -----------------------------------------------------------------------------
 * One decoded spectral measurement: a {@link SpectrumHeader} and its body of raw
 * digital-number (DN) samples.
 *
 * <p>The body holds exactly {@code header.pixelCount()} unsigned 16-bit samples
 * in physical pixel order. A record whose body length differs from the declared
 * pixel count cannot be constructed.</p>
 *
 * <p>Immutability is enforced via defensive copying, so equality is structural
 * over the body contents.</p>
 */
public record SpectrumRecord(SpectrumHeader header, int[] body)
{
    public static final int MAX_SAMPLE = 0xFFFF;

    public SpectrumRecord {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");
        if (body.length != header.pixelCount()) {
            throw new IllegalArgumentException(
                    "Body length " + body.length + " does not match pixel count " + header.pixelCount());
        }
        for (int i = 0; i < body.length; i++) {
            if (body[i] < 0 || body[i] > MAX_SAMPLE) {
                throw new IllegalArgumentException(
                        "Sample " + i + " out of unsigned 16-bit range: " + body[i]);
            }
        }
        body = body.clone();
    }

    /**
     * Returns a copy of the samples.
     */
    @Override
    public int[] body() {
        return body.clone();
    }

    /**
     * Returns a single sample without copying the body.
     */
    public int sample(int pixel) {
        return body[pixel];
    }

    public int pixelCount() {
        return body.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SpectrumRecord that)) return false;
        return header.equals(that.header) && Arrays.equals(body, that.body);
    }

    @Override
    public int hashCode() {
        return 31 * header.hashCode() + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "SpectrumRecord[" +
                "header=" + header +
                ", pixelCount=" + body.length +
                ']';
    }
}
