package com.questrail.radiometer.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class AccelStatsTest
{
    @Test
    void halfScaleIsOneG()
    {
        assertEquals(9.8, AccelStats.toG(16384), 0.0);
    }

    @Test
    void fullNegativeScale()
    {
        assertEquals(-19.6, AccelStats.toG(-32768), 0.0);
    }

    @Test
    void accessorsConvertEachComponent()
    {
        AccelStats stats = new AccelStats((short) 16384, (short) -16384, (short) 0,
                (short) 8192, (short) 0, (short) 32767);

        assertEquals(9.8, stats.meanXG(), 0.0);
        assertEquals(-9.8, stats.meanYG(), 0.0);
        assertEquals(0.0, stats.meanZG(), 0.0);
        assertEquals(4.9, stats.stdXG(), 1e-12);
        assertEquals(0.0, stats.stdYG(), 0.0);
        assertEquals(32767 * 19.6 / 32768.0, stats.stdZG(), 0.0);
    }
}
