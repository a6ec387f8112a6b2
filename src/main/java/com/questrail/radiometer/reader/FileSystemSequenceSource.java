package com.questrail.radiometer.reader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Production {@link SequenceSource} reading from the default file system.
 */
public enum FileSystemSequenceSource implements SequenceSource {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public byte[] read(Path path) throws IOException {
        return Files.readAllBytes(Objects.requireNonNull(path, "path"));
    }
}
