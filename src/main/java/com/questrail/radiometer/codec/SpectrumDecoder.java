package com.questrail.radiometer.codec;

import com.questrail.radiometer.model.SpectrumRecord;

/**
 * SpectrumDecoder
 * -----------------------------------------------------------------------------
 * Decodes one chunk into a {@link SpectrumRecord}.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Interpreting the fixed header layout</li>
 *   <li>Reading exactly the declared number of samples</li>
 *   <li>Detecting chunks too short, or too long, for what their header declares</li>
 * </ul>
 *
 * <p>It is <strong>not</strong> responsible for locating chunk boundaries
 * ({@link ChunkSplitter}) or for deciding whether a bad record aborts the whole
 * file (the reader's policy).</p>
 */
public interface SpectrumDecoder
{
    /**
     * Decodes a single chunk.
     *
     * @param chunk chunk bytes, length prefix included
     * @return the decoded record; its body length always equals its pixel count
     * @throws InsufficientBytesException if the chunk is shorter than its header
     *         or than its declared samples
     * @throws MalformedChunkException if bytes remain after the declared samples
     * @throws UnknownEnumValueException if the decoder is strict and a code is unknown
     */
    SpectrumRecord decode(Chunk chunk);
}
