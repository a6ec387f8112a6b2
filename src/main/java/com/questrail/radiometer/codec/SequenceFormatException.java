package com.questrail.radiometer.codec;

/**
 * Base type for wire-level defects found while splitting or decoding a
 * sequence file.
 *
 * <p>Every instance identifies the file offset at which the defect was
 * detected. Subtypes add the expected and actual sizes, or the offending
 * wire code.</p>
 */
public abstract class SequenceFormatException extends RuntimeException
{
    private final int offset;

    protected SequenceFormatException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /**
     * Returns the byte offset within the sequence file at which the defect
     * was detected.
     */
    public int offset() {
        return offset;
    }
}
