package com.questrail.radiometer.codec;

import java.util.Arrays;

/**
 * Chunk
 * -----------------------------------------------------------------------------
 * One self-delimited span of a sequence file, length prefix included.
 *
 * <p>A chunk knows where it came from ({@link #index()}, {@link #offset()}) so
 * that decode failures can name the offending position in the file. It carries
 * no interpretation of its bytes.</p>
 *
 * Immutability is enforced via defensive copying.
 */
public final class Chunk
{
    private final int index;
    private final int offset;
    private final byte[] bytes;

    public Chunk(int index, int offset, byte[] bytes) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0 (was " + index + ")");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0 (was " + offset + ")");
        }
        this.index = index;
        this.offset = offset;
        this.bytes = (bytes == null) ? new byte[0] : bytes.clone();
    }

    /**
     * Wraps bytes that do not come from a larger file (index and offset 0).
     */
    public static Chunk standalone(byte[] bytes) {
        return new Chunk(0, 0, bytes);
    }

    /**
     * Zero-based position of this chunk within its file.
     */
    public int index() {
        return index;
    }

    /**
     * Byte offset of the first length-prefix byte within the file.
     */
    public int offset() {
        return offset;
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Returns a copy of the chunk bytes, length prefix included.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chunk that)) return false;
        return index == that.index && offset == that.offset && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * index + offset) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Chunk[" +
                "index=" + index +
                ", offset=" + offset +
                ", length=" + bytes.length +
                ']';
    }
}
