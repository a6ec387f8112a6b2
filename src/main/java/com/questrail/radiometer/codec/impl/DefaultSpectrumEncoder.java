package com.questrail.radiometer.codec.impl;

import com.questrail.radiometer.codec.SpectrumEncoder;
import com.questrail.radiometer.model.AccelStats;
import com.questrail.radiometer.model.SpectrumHeader;
import com.questrail.radiometer.model.SpectrumRecord;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;

import java.util.Objects;

import static com.questrail.radiometer.codec.impl.SpectrumWireLayout.*;

/**
 * DefaultSpectrumEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link SpectrumEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultSpectrumDecoder}. Reserved
 * header bytes are written as zero. Unknown enum codes are written back as their
 * raw value.</p>
 */
public final class DefaultSpectrumEncoder implements SpectrumEncoder
{
    @Override
    public byte[] encode(SpectrumRecord record) {
        Objects.requireNonNull(record, "record");

        final SpectrumHeader header = record.header();
        final int pixelCount = header.pixelCount();
        if (pixelCount > MAX_PIXEL_COUNT) {
            throw new IllegalArgumentException(
                    "pixelCount " + pixelCount + " exceeds chunk capacity of " + MAX_PIXEL_COUNT);
        }

        final int radiometerCode = requireCode("radiometer", header.spectrumType().radiometer().code());
        final int opticsCode = requireCode("optics", header.spectrumType().optics().code());
        final int length = chunkLength(pixelCount);
        final AccelStats accel = header.accelStats();

        ByteBuf buf = Unpooled.buffer(length, length);
        try {
            buf.writeShortLE(length);
            buf.writeLongLE(header.timestamp());
            buf.writeByte(radiometerCode);
            buf.writeByte(opticsCode);
            buf.writeIntLE((int) header.exposureTime());
            buf.writeShortLE(pixelCount);
            buf.writeFloatLE(header.temperature());
            buf.writeShortLE(accel.meanX());
            buf.writeShortLE(accel.meanY());
            buf.writeShortLE(accel.meanZ());
            buf.writeShortLE(accel.stdX());
            buf.writeShortLE(accel.stdY());
            buf.writeShortLE(accel.stdZ());
            buf.writeZero(RESERVED_SIZE);

            for (int i = 0; i < pixelCount; i++) {
                buf.writeShortLE(record.sample(i));
            }

            return ByteBufUtil.getBytes(buf);
        }
        finally {
            buf.release();
        }
    }

    private static int requireCode(String field, int code) {
        if (code < 0 || code > MAX_CODE) {
            throw new IllegalArgumentException(
                    field + " code " + code + " does not fit in one byte");
        }
        return code;
    }
}
