package com.questrail.radiometer.codec.impl;

import com.questrail.radiometer.codec.Chunk;
import com.questrail.radiometer.codec.InsufficientBytesException;
import com.questrail.radiometer.codec.MalformedChunkException;
import com.questrail.radiometer.codec.SpectrumDecoder;
import com.questrail.radiometer.codec.UnknownEnumValueException;
import com.questrail.radiometer.model.AccelStats;
import com.questrail.radiometer.model.CodedValue;
import com.questrail.radiometer.model.Optics;
import com.questrail.radiometer.model.Radiometer;
import com.questrail.radiometer.model.SpectrumHeader;
import com.questrail.radiometer.model.SpectrumRecord;
import com.questrail.radiometer.model.SpectrumType;
import com.questrail.radiometer.model.WireCoded;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.util.Objects;

import static com.questrail.radiometer.codec.impl.SpectrumWireLayout.*;

/**
 * DefaultSpectrumDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SpectrumDecoder} for the layout described in
 * {@link SpectrumWireLayout}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Check the chunk is long enough for the fixed header</li>
 *   <li>Read the header fields at their fixed offsets</li>
 *   <li>Check the chunk length matches header plus declared samples exactly</li>
 *   <li>Read {@code pixelCount} samples</li>
 * </ol>
 *
 * <p>The declared chunk length in the prefix is not re-checked here: the chunk
 * handed in is already the span {@code ChunkSplitter} cut using that prefix.</p>
 *
 * <h2>Unknown codes</h2>
 * <p>A lenient decoder (the default) keeps unrecognised radiometer and optics
 * codes as {@link CodedValue.Unknown}. A strict decoder rejects them with
 * {@link UnknownEnumValueException}.</p>
 *
 * <h2>Netty containment</h2>
 * <p>Netty {@link ByteBuf} is used for little-endian field access only and never
 * escapes this package.</p>
 */
public final class DefaultSpectrumDecoder implements SpectrumDecoder
{
    private final boolean strictEnumCodes;

    /**
     * Creates a lenient decoder.
     */
    public DefaultSpectrumDecoder() {
        this(false);
    }

    /**
     * @param strictEnumCodes reject unknown radiometer / optics codes instead of
     *                        keeping them as {@link CodedValue.Unknown}
     */
    public DefaultSpectrumDecoder(boolean strictEnumCodes) {
        this.strictEnumCodes = strictEnumCodes;
    }

    @Override
    public SpectrumRecord decode(Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk");

        final int length = chunk.length();
        if (length < HEADER_SIZE) {
            throw new InsufficientBytesException(
                    "Chunk " + chunk.index() + " shorter than spectrum header",
                    chunk.offset(), HEADER_SIZE, length);
        }

        ByteBuf buf = Unpooled.wrappedBuffer(chunk.bytes());
        try {
            final long timestamp = buf.getLongLE(TIMESTAMP_OFFSET);
            final int radiometerCode = buf.getUnsignedByte(RADIOMETER_OFFSET);
            final int opticsCode = buf.getUnsignedByte(OPTICS_OFFSET);
            final long exposureTime = buf.getUnsignedIntLE(EXPOSURE_OFFSET);
            final int pixelCount = buf.getUnsignedShortLE(PIXEL_COUNT_OFFSET);
            final float temperature = buf.getFloatLE(TEMPERATURE_OFFSET);
            final AccelStats accel = new AccelStats(
                    buf.getShortLE(ACCEL_OFFSET), buf.getShortLE(ACCEL_OFFSET + 2), buf.getShortLE(ACCEL_OFFSET + 4),
                    buf.getShortLE(ACCEL_OFFSET + 6), buf.getShortLE(ACCEL_OFFSET + 8), buf.getShortLE(ACCEL_OFFSET + 10));

            final int expected = chunkLength(pixelCount);
            if (length < expected) {
                throw new InsufficientBytesException(
                        "Chunk " + chunk.index() + " too short for " + pixelCount + " declared pixels",
                        chunk.offset(), expected, length);
            }
            if (length > expected) {
                throw new MalformedChunkException(
                        "Chunk " + chunk.index() + " has trailing bytes after " + pixelCount + " declared pixels",
                        chunk.offset(), expected, length);
            }

            final SpectrumType type = new SpectrumType(
                    checked("radiometer", Radiometer.fromCode(radiometerCode), chunk.offset() + RADIOMETER_OFFSET),
                    checked("optics", Optics.fromCode(opticsCode), chunk.offset() + OPTICS_OFFSET));

            final int[] body = new int[pixelCount];
            for (int i = 0; i < pixelCount; i++) {
                body[i] = buf.getUnsignedShortLE(HEADER_SIZE + i * SAMPLE_SIZE);
            }

            SpectrumHeader header = new SpectrumHeader(
                    timestamp, type, exposureTime, pixelCount, temperature, accel);
            return new SpectrumRecord(header, body);
        }
        finally {
            buf.release();
        }
    }

    private <E extends Enum<E> & WireCoded> CodedValue<E> checked(
            String field, CodedValue<E> value, int offset) {

        if (strictEnumCodes && value instanceof CodedValue.Unknown<?> unknown) {
            throw new UnknownEnumValueException(field, unknown.code(), offset);
        }
        return value;
    }
}
