package com.questrail.radiometer.reader;

import com.questrail.radiometer.codec.ChunkDecodeResult;
import com.questrail.radiometer.codec.ChunkSplitter;
import com.questrail.radiometer.codec.DecodingStage;
import com.questrail.radiometer.codec.SequenceFormatException;
import com.questrail.radiometer.codec.SpectrumDecoder;
import com.questrail.radiometer.codec.impl.DefaultSpectrumDecoder;
import com.questrail.radiometer.config.BadRecordPolicy;
import com.questrail.radiometer.config.SequenceReaderConfig;
import com.questrail.radiometer.model.SkippedChunk;
import com.questrail.radiometer.model.SpectrumFile;
import com.questrail.radiometer.model.SpectrumRecord;
import com.questrail.radiometer.observability.NullObservabilitySink;
import com.questrail.radiometer.observability.RecordSkippedEvent;
import com.questrail.radiometer.observability.SequenceErrorEvent;
import com.questrail.radiometer.observability.SequenceLoadedEvent;
import com.questrail.radiometer.observability.SequenceObservabilitySink;
import com.questrail.radiometer.time.SystemWallClock;
import com.questrail.radiometer.time.WallClock;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SequenceReader
 * =============================================================================
 * Loads a sequence file into an ordered {@link SpectrumFile}.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   SequenceSource.read(path)
 *        → ChunkSplitter.split
 *            → DecodingStage (SpectrumDecoder per chunk)
 *                → BadRecordPolicy
 *                    → SpectrumFile
 * </pre>
 *
 * <h2>Failure semantics</h2>
 * <ul>
 *   <li>I/O failure or any chunk-splitting defect: the load fails with a single
 *       {@link SequenceLoadException} and no records.</li>
 *   <li>A record that fails to decode: fails the load under
 *       {@link BadRecordPolicy#FAIL_FAST}; under {@link BadRecordPolicy#SKIP}
 *       the record is dropped and listed in {@link SpectrumFile#skippedChunks()}.
 *       Skip events reach the observability sink only if the load as a whole
 *       succeeds.</li>
 * </ul>
 *
 * <p>Records keep file order; file order is acquisition order.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances hold only immutable collaborators. Concurrent loads of different
 * files share nothing.</p>
 */
public final class SequenceReader
{
    private final SequenceSource source;
    private final DecodingStage decodingStage;
    private final SequenceReaderConfig config;
    private final SequenceObservabilitySink observabilitySink;
    private final WallClock clock;

    /**
     * Creates a reader over the default file system with default configuration
     * and no observability.
     */
    public SequenceReader() {
        this(builder());
    }

    private SequenceReader(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config");
        this.source = Objects.requireNonNull(builder.source, "source");
        this.observabilitySink = Objects.requireNonNull(builder.observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(builder.clock, "clock");

        SpectrumDecoder decoder = (builder.decoder != null)
                ? builder.decoder
                : new DefaultSpectrumDecoder(config.strictEnumCodes());
        this.decodingStage = new DecodingStage(decoder);
    }

    /**
     * Reads and decodes the sequence file at {@code path}.
     *
     * @return every record of the file, in file order
     * @throws SequenceLoadException if the file cannot be read or decoded
     */
    public SpectrumFile load(Path path) throws SequenceLoadException {
        Objects.requireNonNull(path, "path");
        final String name = String.valueOf(path.getFileName());

        final byte[] bytes;
        try {
            bytes = source.read(path);
        }
        catch (IOException e) {
            throw fail(name, "Cannot read sequence file", e);
        }
        return decode(name, bytes);
    }

    /**
     * Decodes an in-memory sequence file buffer.
     *
     * @param name  name reported in results, events and errors
     * @param bytes complete file contents
     * @throws SequenceLoadException if the buffer cannot be decoded
     */
    public SpectrumFile decode(String name, byte[] bytes) throws SequenceLoadException {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(bytes, "bytes");

        final List<SpectrumRecord> records = new ArrayList<>();
        final List<SkippedChunk> skipped = new ArrayList<>();
        // Held back until the whole file has split cleanly.
        final List<RecordSkippedEvent> skipEvents = new ArrayList<>();
        int chunkCount = 0;

        try {
            for (ChunkDecodeResult result : decodingStage.decode(ChunkSplitter.split(bytes))) {
                chunkCount++;

                if (result instanceof ChunkDecodeResult.Decoded decoded) {
                    records.add(decoded.record());
                    continue;
                }

                ChunkDecodeResult.Failed failed = (ChunkDecodeResult.Failed) result;
                if (config.badRecordPolicy() == BadRecordPolicy.FAIL_FAST) {
                    throw fail(name, "Cannot decode record " + (failed.chunk().index() + 1), failed.error());
                }

                SkippedChunk chunk = new SkippedChunk(
                        failed.chunk().index(),
                        failed.chunk().offset(),
                        failed.chunk().length(),
                        failed.error().getMessage());
                skipped.add(chunk);
                skipEvents.add(new RecordSkippedEvent(clock.now(), name, chunk, failed.error()));
            }
        }
        catch (SequenceFormatException e) {
            throw fail(name, "Corrupt sequence file", e);
        }

        SpectrumFile file = new SpectrumFile(name, records, chunkCount, skipped);
        skipEvents.forEach(observabilitySink::onRecordSkipped);
        observabilitySink.onSequenceLoaded(new SequenceLoadedEvent(
                clock.now(), name, chunkCount, records.size(), skipped.size()));
        return file;
    }

    private SequenceLoadException fail(String name, String message, Throwable cause) {
        SequenceLoadException e = new SequenceLoadException(name, message + ": " + cause.getMessage(), cause);
        observabilitySink.onError(new SequenceErrorEvent(clock.now(), name, e.getMessage(), cause));
        return e;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SequenceSource source = FileSystemSequenceSource.INSTANCE;
        private SpectrumDecoder decoder;
        private SequenceReaderConfig config = SequenceReaderConfig.defaults();
        private SequenceObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock clock = SystemWallClock.INSTANCE;

        public Builder withSource(SequenceSource source) {
            this.source = source;
            return this;
        }

        /**
         * Overrides the decoder. When unset, a {@link DefaultSpectrumDecoder}
         * honouring {@link SequenceReaderConfig#strictEnumCodes()} is used.
         */
        public Builder withDecoder(SpectrumDecoder decoder) {
            this.decoder = decoder;
            return this;
        }

        public Builder withConfig(SequenceReaderConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(SequenceObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public SequenceReader build() {
            return new SequenceReader(this);
        }
    }
}
