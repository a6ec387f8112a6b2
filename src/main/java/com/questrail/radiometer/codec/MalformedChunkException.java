package com.questrail.radiometer.codec;

/**
 * A chunk's declared length is inconsistent with the bytes around it: shorter
 * than its own length field, running past the end of the buffer, or not
 * matching the payload its header describes.
 *
 * <p>Usually means the file is corrupt or parsing has desynchronised.</p>
 */
public final class MalformedChunkException extends SequenceFormatException
{
    private final int expected;
    private final int actual;

    public MalformedChunkException(String message, int offset, int expected, int actual) {
        super(message + " at offset " + offset + " (expected " + expected + " bytes, found " + actual + ")",
                offset);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
