package com.questrail.radiometer.codec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * ChunkSplitter
 * -----------------------------------------------------------------------------
 * Slices a sequence file buffer into its self-delimited chunks.
 *
 * <p>Each chunk starts with an unsigned little-endian 16-bit length that counts
 * the length field itself plus the chunk body. Splitting walks a cursor from
 * offset 0, reading one length prefix at a time, until the cursor lands exactly
 * on the end of the buffer.</p>
 *
 * <p>Failures:</p>
 * <ul>
 *   <li>fewer than two bytes at the cursor: {@link TruncatedLengthPrefixException}</li>
 *   <li>declared length below two, or past the end of the buffer:
 *       {@link MalformedChunkException}</li>
 * </ul>
 *
 * <p>This class does not interpret chunk contents; see {@link SpectrumDecoder}.</p>
 */
public final class ChunkSplitter
{
    /** Size of the chunk length prefix in bytes. */
    public static final int LENGTH_FIELD_SIZE = 2;

    private ChunkSplitter() {}

    /**
     * Returns a lazy view over the chunks of {@code buffer}.
     *
     * <p>Each call to {@link Iterable#iterator()} restarts from offset 0. Errors
     * are raised from {@link Iterator#next()} when the offending chunk is
     * reached, so chunks before a defect are still produced.</p>
     *
     * @param buffer complete sequence file contents (copied)
     */
    public static Iterable<Chunk> split(byte[] buffer) {
        if (buffer == null) {
            throw new IllegalArgumentException("buffer must not be null");
        }
        final byte[] data = buffer.clone();
        return () -> new ChunkIterator(data);
    }

    /**
     * Splits the whole buffer eagerly.
     *
     * @throws SequenceFormatException on the first defect; no partial list is returned
     */
    public static List<Chunk> splitAll(byte[] buffer) {
        List<Chunk> chunks = new ArrayList<>();
        for (Chunk chunk : split(buffer)) {
            chunks.add(chunk);
        }
        return chunks;
    }

    /**
     * Reads the unsigned little-endian 16-bit length prefix at {@code offset}.
     *
     * @throws TruncatedLengthPrefixException if fewer than two bytes remain
     */
    public static int readLengthPrefix(byte[] buffer, int offset) {
        int remaining = buffer.length - offset;
        if (remaining < LENGTH_FIELD_SIZE) {
            throw new TruncatedLengthPrefixException(offset, remaining);
        }
        return (buffer[offset] & 0xFF) | ((buffer[offset + 1] & 0xFF) << 8);
    }

    private static final class ChunkIterator implements Iterator<Chunk>
    {
        private final byte[] data;
        private int cursor;
        private int index;

        private ChunkIterator(byte[] data) {
            this.data = data;
        }

        @Override
        public boolean hasNext() {
            return cursor < data.length;
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No chunks remain at offset " + cursor);
            }

            final int length = readLengthPrefix(data, cursor);
            final int remaining = data.length - cursor;

            if (length < LENGTH_FIELD_SIZE) {
                throw new MalformedChunkException(
                        "Chunk length " + length + " is shorter than its own length field",
                        cursor, LENGTH_FIELD_SIZE, length);
            }
            if (length > remaining) {
                throw new MalformedChunkException(
                        "Chunk length " + length + " runs past the end of the buffer",
                        cursor, length, remaining);
            }

            Chunk chunk = new Chunk(index, cursor, Arrays.copyOfRange(data, cursor, cursor + length));
            cursor += length;
            index++;
            return chunk;
        }
    }
}
