package com.questrail.radiometer.codec;

/**
 * An enum-coded header field carried a code with no known meaning.
 *
 * <p>Only raised by decoders running in strict mode; lenient decoders keep the
 * raw code in the decoded record instead.</p>
 */
public final class UnknownEnumValueException extends SequenceFormatException
{
    private final String field;
    private final int code;

    public UnknownEnumValueException(String field, int code, int offset) {
        super("Unknown " + field + " code " + code + " at offset " + offset, offset);
        this.field = field;
        this.code = code;
    }

    public String field() {
        return field;
    }

    public int code() {
        return code;
    }
}
