package com.questrail.radiometer.reader;

import com.questrail.radiometer.codec.SequenceFormatException;

import java.util.Objects;
import java.util.Optional;

/**
 * A sequence file could not be loaded. No records are available when this is
 * thrown.
 *
 * <p>The cause is either the {@link java.io.IOException} from reading the file,
 * or the {@link SequenceFormatException} describing the wire defect.</p>
 */
public final class SequenceLoadException extends Exception
{
    private final String source;

    public SequenceLoadException(String source, String message, Throwable cause) {
        super(Objects.requireNonNull(source, "source") + ": " + message, cause);
        this.source = source;
    }

    /**
     * Returns the name of the file that failed to load.
     */
    public String source() {
        return source;
    }

    /**
     * Returns the wire defect, when the load failed while splitting or decoding.
     */
    public Optional<SequenceFormatException> formatError() {
        return (getCause() instanceof SequenceFormatException e) ? Optional.of(e) : Optional.empty();
    }
}
