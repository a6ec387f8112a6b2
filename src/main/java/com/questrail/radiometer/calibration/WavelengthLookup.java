package com.questrail.radiometer.calibration;

import com.questrail.radiometer.model.CodedValue;
import com.questrail.radiometer.model.Radiometer;

import java.util.Objects;

/**
 * Outcome of a single pixel-to-wavelength lookup.
 *
 * <p>{@link CalibrationUnavailable} is an expected outcome, not an error: the
 * caller falls back to the raw pixel index.</p>
 */
public sealed interface WavelengthLookup
        permits WavelengthLookup.Wavelength, WavelengthLookup.CalibrationUnavailable
{
    boolean isAvailable();

    record Wavelength(double nanometers) implements WavelengthLookup
    {
        @Override
        public boolean isAvailable() {
            return true;
        }
    }

    record CalibrationUnavailable(CodedValue<Radiometer> channel) implements WavelengthLookup
    {
        public CalibrationUnavailable {
            Objects.requireNonNull(channel, "channel");
        }

        @Override
        public boolean isAvailable() {
            return false;
        }
    }
}
