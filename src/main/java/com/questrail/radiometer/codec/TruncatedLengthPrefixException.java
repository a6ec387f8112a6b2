package com.questrail.radiometer.codec;

/**
 * Fewer than two bytes remained where a chunk length prefix was expected.
 */
public final class TruncatedLengthPrefixException extends SequenceFormatException
{
    private final int remaining;

    public TruncatedLengthPrefixException(int offset, int remaining) {
        super("Truncated chunk length prefix at offset " + offset
                + " (expected " + ChunkSplitter.LENGTH_FIELD_SIZE + " bytes, found " + remaining + ")", offset);
        this.remaining = remaining;
    }

    public int expected() {
        return ChunkSplitter.LENGTH_FIELD_SIZE;
    }

    public int actual() {
        return remaining;
    }
}
