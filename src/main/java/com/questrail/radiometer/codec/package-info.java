/**
 * Sequence file codec
 * =============================================================================
 *
 * <p>Wire-level handling of radiometer sequence files. A sequence file is a
 * plain concatenation of chunks; each chunk is one spectral measurement:</p>
 *
 * <pre>
 *   [ u16 length ][ 38-byte header ][ pixelCount × u16 samples ]
 * </pre>
 *
 * <p>All multi-byte values are little-endian.</p>
 *
 * <h2>Layering</h2>
 * <pre>
 *   byte[] file
 *        → ChunkSplitter       (boundaries from length prefixes)
 *            → Chunk
 *                → SpectrumDecoder   (header + samples)
 *                    → SpectrumRecord
 * </pre>
 *
 * <p>Chunk boundaries come from the length prefixes alone, independently of
 * what each header declares. A record that fails to decode therefore does not
 * move the boundaries of the chunks after it.</p>
 *
 * <p>Concrete codec implementations live in {@code codec.impl}; nothing outside
 * that package depends on how bytes are read.</p>
 */
package com.questrail.radiometer.codec;
