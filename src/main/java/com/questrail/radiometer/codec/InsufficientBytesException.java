package com.questrail.radiometer.codec;

/**
 * A chunk is shorter than its fixed header, or than the header plus the
 * samples its pixel count declares.
 */
public final class InsufficientBytesException extends SequenceFormatException
{
    private final int expected;
    private final int actual;

    public InsufficientBytesException(String message, int offset, int expected, int actual) {
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
