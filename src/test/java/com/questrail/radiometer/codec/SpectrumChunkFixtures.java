package com.questrail.radiometer.codec;

import java.io.ByteArrayOutputStream;

/**
 * Builds spectrum chunks byte by byte, independently of the production encoder.
 *
 * <p>The length prefix is always {@code 40 + 2 × samples.length}; the declared
 * pixel count may differ to produce inconsistent chunks.</p>
 */
public final class SpectrumChunkFixtures
{
    public static final int HEADER_SIZE = 40;

    private SpectrumChunkFixtures() {}

    public static byte[] chunk(long timestamp,
                               int radiometerCode,
                               int opticsCode,
                               long exposureTime,
                               int declaredPixelCount,
                               float temperature,
                               short[] accel,
                               int... samples)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeU16(out, HEADER_SIZE + 2 * samples.length);
        for (int i = 0; i < 8; i++) {
            out.write((int) (timestamp >>> (8 * i)) & 0xFF);
        }
        out.write(radiometerCode);
        out.write(opticsCode);
        for (int i = 0; i < 4; i++) {
            out.write((int) (exposureTime >>> (8 * i)) & 0xFF);
        }
        writeU16(out, declaredPixelCount);
        int bits = Float.floatToIntBits(temperature);
        for (int i = 0; i < 4; i++) {
            out.write((bits >>> (8 * i)) & 0xFF);
        }
        for (short a : accel) {
            writeU16(out, a & 0xFFFF);
        }
        out.writeBytes(new byte[6]);
        for (int sample : samples) {
            writeU16(out, sample);
        }
        return out.toByteArray();
    }

    /**
     * A consistent VIS / DIRECT chunk with zero accelerometer readings.
     */
    public static byte[] visChunk(long timestamp, int... samples)
    {
        return chunk(timestamp, 0, 0, 100, samples.length, 21.5f, new short[6], samples);
    }

    public static byte[] concat(byte[]... parts)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            out.writeBytes(part);
        }
        return out.toByteArray();
    }

    private static void writeU16(ByteArrayOutputStream out, int value)
    {
        out.write(value & 0xFF);
        out.write((value >>> 8) & 0xFF);
    }
}
