package com.questrail.radiometer.format;

import com.questrail.radiometer.model.AccelStats;
import com.questrail.radiometer.model.CodedValue;
import com.questrail.radiometer.model.Optics;
import com.questrail.radiometer.model.Radiometer;
import com.questrail.radiometer.model.SpectrumHeader;
import com.questrail.radiometer.model.SpectrumRecord;
import com.questrail.radiometer.model.SpectrumType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SpectrumFormatterTest
{
    // 2023-11-14 22:13:20 UTC
    private static final long TIMESTAMP = 1_700_000_000_000L;

    private final SpectrumHeader header = new SpectrumHeader(
            TIMESTAMP, SpectrumType.of(Radiometer.VIS, Optics.COSINE), 120, 0, 23.456f,
            new AccelStats((short) 16384, (short) 0, (short) -16384, (short) 164, (short) 0, (short) 82));

    @Test
    void listLabel()
    {
        SpectrumRecord record = new SpectrumRecord(header, new int[0]);

        assertEquals("3-1700000000000-VIS-COSINE", SpectrumFormatter.listLabel(3, record));
    }

    @Test
    void listLabelShowsUnknownCodes()
    {
        SpectrumHeader unknown = new SpectrumHeader(5L,
                new SpectrumType(Radiometer.fromCode(8), new CodedValue.Known<>(Optics.DIRECT)),
                1, 0, 0f, AccelStats.ZERO);

        assertEquals("1-5-UNKNOWN(8)-DIRECT",
                SpectrumFormatter.listLabel(1, new SpectrumRecord(unknown, new int[0])));
    }

    @Test
    void timestampIsUtc()
    {
        assertEquals("2023-11-14 22:13:20", SpectrumFormatter.timestampText(header));
    }

    @Test
    void plotTitle()
    {
        assertEquals("VIS COSINE, 120ms, 23.46 °C", SpectrumFormatter.plotTitle(header));
    }

    @Test
    void accelerometerAxes()
    {
        assertEquals("9.80 ±0.10", SpectrumFormatter.accelXText(header.accelStats()));
        assertEquals("0.00 ±0.00", SpectrumFormatter.accelYText(header.accelStats()));
        assertEquals("-9.80 ±0.05", SpectrumFormatter.accelZText(header.accelStats()));
    }

    @Test
    void temperatureTiesRoundToEven()
    {
        SpectrumHeader tie = new SpectrumHeader(TIMESTAMP, SpectrumType.of(Radiometer.VIS, Optics.DIRECT),
                100, 0, 21.125f, AccelStats.ZERO);

        assertEquals("21.12", SpectrumFormatter.temperatureText(tie));
        assertEquals("VIS DIRECT, 100ms, 21.12 °C", SpectrumFormatter.plotTitle(tie));
    }

    @Test
    void accelerometerTiesRoundToEven()
    {
        // 10240 raw is exactly 6.125 g
        assertEquals("6.12 ±0.00", SpectrumFormatter.accelText(10240, 0));
        assertEquals("-6.12 ±0.00", SpectrumFormatter.accelText(-10240, 0));
    }

    @Test
    void exportFileNameUsesSequenceId()
    {
        assertEquals("M20240601_0042_7.png",
                SpectrumFormatter.exportFileName("M20240601", "SEQ_0042_A.spe", 7));
    }

    @Test
    void exportFileNameWithoutSequenceIdUsesBaseName()
    {
        assertEquals("M1_plain_2.png", SpectrumFormatter.exportFileName("M1", "plain.spe", 2));
    }
}
