package com.questrail.radiometer.codec;

import java.util.Iterator;
import java.util.Objects;

/**
 * DecodingStage
 * -----------------------------------------------------------------------------
 * Second stage of the sequence pipeline: maps chunks to per-chunk decode
 * outcomes.
 *
 * <pre>
 *   byte[] file
 *        → ChunkSplitter   (boundaries; splitting errors propagate)
 *            → DecodingStage (one ChunkDecodeResult per chunk)
 *                → reader policy (fail fast or skip)
 * </pre>
 *
 * <p>Decode failures are captured as {@link ChunkDecodeResult.Failed} rather than
 * thrown, so this stage imposes no error policy of its own. Splitting errors
 * from the upstream iterable are not decode failures and propagate unchanged.</p>
 */
public final class DecodingStage
{
    private final SpectrumDecoder decoder;

    public DecodingStage(SpectrumDecoder decoder) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * Returns a lazy view decoding each chunk of {@code chunks} on demand.
     */
    public Iterable<ChunkDecodeResult> decode(Iterable<Chunk> chunks) {
        Objects.requireNonNull(chunks, "chunks");
        return () -> new Iterator<>() {
            private final Iterator<Chunk> upstream = chunks.iterator();

            @Override
            public boolean hasNext() {
                return upstream.hasNext();
            }

            @Override
            public ChunkDecodeResult next() {
                Chunk chunk = upstream.next();
                try {
                    return new ChunkDecodeResult.Decoded(chunk, decoder.decode(chunk));
                } catch (SequenceFormatException e) {
                    return new ChunkDecodeResult.Failed(chunk, e);
                }
            }
        };
    }
}
