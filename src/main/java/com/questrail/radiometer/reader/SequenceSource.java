package com.questrail.radiometer.reader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Supplies the raw bytes of a named sequence file.
 *
 * <p>This is the only blocking step of a load; decoding works on the returned
 * buffer alone.</p>
 */
@FunctionalInterface
public interface SequenceSource
{
    /**
     * Reads the complete contents of {@code path}.
     *
     * @throws IOException if the file cannot be read
     */
    byte[] read(Path path) throws IOException;
}
