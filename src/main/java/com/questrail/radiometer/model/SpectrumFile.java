package com.questrail.radiometer.model;

import java.util.List;
import java.util.Objects;

/**
 * SpectrumFile
 * -----------------------------------------------------------------------------
 * Fully decoded content of one sequence file.
 *
 * <p>Records appear in file order, which is acquisition order. Instances are
 * immutable: selecting a different file produces a new {@code SpectrumFile};
 * nothing is ever appended to or removed from an existing one.</p>
 *
 * @param source        name of the file the records were decoded from
 * @param records       decoded records in file order
 * @param chunkCount    number of chunks found in the file
 * @param skippedChunks chunks dropped under the skip policy (empty otherwise)
 */
public record SpectrumFile(
        String source,
        List<SpectrumRecord> records,
        int chunkCount,
        List<SkippedChunk> skippedChunks
)
{
    public SpectrumFile {
        Objects.requireNonNull(source, "source");
        records = List.copyOf(records);
        skippedChunks = List.copyOf(skippedChunks);
        if (records.size() + skippedChunks.size() != chunkCount) {
            throw new IllegalArgumentException(
                    "chunkCount " + chunkCount + " does not match " + records.size()
                            + " records plus " + skippedChunks.size() + " skipped chunks");
        }
    }

    public int size() {
        return records.size();
    }

    public SpectrumRecord get(int index) {
        return records.get(index);
    }

    public boolean isComplete() {
        return skippedChunks.isEmpty();
    }
}
