package com.questrail.radiometer.calibration;

import com.questrail.radiometer.model.CodedValue;
import com.questrail.radiometer.model.Radiometer;
import com.questrail.radiometer.model.SpectrumRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * CalibrationEngine
 * =============================================================================
 * Converts pixel indices to wavelengths using the {@link CalibrationTable}
 * given at construction.
 *
 * <p>Coefficients are selected strictly by the record's own radiometer channel.
 * A channel with no registered coefficients, or an unrecognised channel code,
 * yields {@link WavelengthLookup.CalibrationUnavailable}; another channel's
 * polynomial is never substituted.</p>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances hold only the immutable table and may be shared freely.</p>
 */
public final class CalibrationEngine
{
    private final CalibrationTable table;

    public CalibrationEngine(CalibrationTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public WavelengthLookup wavelength(int pixelIndex, Radiometer channel) {
        return wavelength(pixelIndex, new CodedValue.Known<>(Objects.requireNonNull(channel, "channel")));
    }

    /**
     * Returns the wavelength of a single zero-based pixel.
     */
    public WavelengthLookup wavelength(int pixelIndex, CodedValue<Radiometer> channel) {
        requirePixelIndex(pixelIndex);
        Objects.requireNonNull(channel, "channel");

        return polynomialFor(channel)
                .<WavelengthLookup>map(p -> new WavelengthLookup.Wavelength(p.evaluate(pixelIndex)))
                .orElseGet(() -> new WavelengthLookup.CalibrationUnavailable(channel));
    }

    public Optional<double[]> wavelengths(int pixelCount, Radiometer channel) {
        return wavelengths(pixelCount, new CodedValue.Known<>(Objects.requireNonNull(channel, "channel")));
    }

    /**
     * Returns wavelengths for pixels {@code 0..pixelCount-1}, or empty when the
     * channel has no calibration.
     */
    public Optional<double[]> wavelengths(int pixelCount, CodedValue<Radiometer> channel) {
        if (pixelCount < 0) {
            throw new IllegalArgumentException("pixelCount must be >= 0 (was " + pixelCount + ")");
        }
        Objects.requireNonNull(channel, "channel");

        return polynomialFor(channel).map(p -> {
            double[] axis = new double[pixelCount];
            for (int x = 0; x < pixelCount; x++) {
                axis[x] = p.evaluate(x);
            }
            return axis;
        });
    }

    /**
     * Returns the x-axis for plotting {@code record}: wavelengths when its
     * channel is calibrated, pixel indices otherwise.
     */
    public SpectralAxis axisFor(SpectrumRecord record) {
        Objects.requireNonNull(record, "record");
        final int pixelCount = record.pixelCount();

        return wavelengths(pixelCount, record.header().spectrumType().radiometer())
                .<SpectralAxis>map(SpectralAxis.WavelengthAxis::new)
                .orElseGet(() -> new SpectralAxis.PixelAxis(pixelCount));
    }

    public boolean isCalibrated(CodedValue<Radiometer> channel) {
        return polynomialFor(Objects.requireNonNull(channel, "channel")).isPresent();
    }

    private Optional<CalibrationPolynomial> polynomialFor(CodedValue<Radiometer> channel) {
        return channel.known().flatMap(table::find);
    }

    private static void requirePixelIndex(int pixelIndex) {
        if (pixelIndex < 0) {
            throw new IllegalArgumentException("pixelIndex must be >= 0 (was " + pixelIndex + ")");
        }
    }
}
