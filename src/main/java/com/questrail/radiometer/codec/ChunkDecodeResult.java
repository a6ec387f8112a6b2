package com.questrail.radiometer.codec;

import com.questrail.radiometer.model.SpectrumRecord;

import java.util.Objects;

/**
 * Outcome of decoding one chunk in a {@link DecodingStage}.
 */
public sealed interface ChunkDecodeResult
        permits ChunkDecodeResult.Decoded, ChunkDecodeResult.Failed
{
    Chunk chunk();

    record Decoded(Chunk chunk, SpectrumRecord record) implements ChunkDecodeResult
    {
        public Decoded {
            Objects.requireNonNull(chunk, "chunk");
            Objects.requireNonNull(record, "record");
        }
    }

    record Failed(Chunk chunk, SequenceFormatException error) implements ChunkDecodeResult
    {
        public Failed {
            Objects.requireNonNull(chunk, "chunk");
            Objects.requireNonNull(error, "error");
        }
    }
}
