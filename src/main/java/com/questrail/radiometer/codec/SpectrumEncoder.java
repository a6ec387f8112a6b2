package com.questrail.radiometer.codec;

import com.questrail.radiometer.model.SpectrumRecord;

import java.io.ByteArrayOutputStream;

/**
 * Encodes {@link SpectrumRecord}s into the chunk layout read by
 * {@link SpectrumDecoder}.
 */
public interface SpectrumEncoder
{
    /**
     * Encodes one record as a complete chunk, length prefix included.
     *
     * @throws IllegalArgumentException if the record cannot be represented on
     *         the wire (an enum code above 255, or a chunk over 65535 bytes)
     */
    byte[] encode(SpectrumRecord record);

    /**
     * Encodes records back to back, producing a sequence file buffer.
     */
    default byte[] encodeAll(Iterable<SpectrumRecord> records) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (SpectrumRecord record : records) {
            out.writeBytes(encode(record));
        }
        return out.toByteArray();
    }
}
