package com.questrail.radiometer.calibration;

import com.questrail.radiometer.model.Radiometer;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Per-channel wavelength calibration coefficients.
 *
 * <p>Immutable once built; a single table is normally loaded at startup and
 * shared by every {@link CalibrationEngine}.</p>
 */
public final class CalibrationTable
{
    /** Classpath resource holding the bundled instrument calibration. */
    public static final String DEFAULT_RESOURCE = "radiometer-calibration.properties";

    private final Map<Radiometer, CalibrationPolynomial> channels;

    private CalibrationTable(Map<Radiometer, CalibrationPolynomial> channels) {
        this.channels = Collections.unmodifiableMap(new EnumMap<>(channels));
    }

    /**
     * Loads the bundled calibration from {@value #DEFAULT_RESOURCE}.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static CalibrationTable defaults() {
        return CalibrationTableLoader.fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Returns the polynomial registered for {@code radiometer}, if any.
     */
    public Optional<CalibrationPolynomial> find(Radiometer radiometer) {
        return Optional.ofNullable(channels.get(Objects.requireNonNull(radiometer, "radiometer")));
    }

    /**
     * Returns the set of channels with registered coefficients.
     */
    public Set<Radiometer> channels() {
        return channels.keySet();
    }

    @Override
    public String toString() {
        return "CalibrationTable" + channels;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<Radiometer, CalibrationPolynomial> channels = new EnumMap<>(Radiometer.class);

        public Builder withChannel(Radiometer radiometer, CalibrationPolynomial polynomial) {
            Objects.requireNonNull(radiometer, "radiometer");
            Objects.requireNonNull(polynomial, "polynomial");
            if (channels.containsKey(radiometer)) {
                throw new IllegalArgumentException("Duplicate calibration for " + radiometer);
            }
            channels.put(radiometer, polynomial);
            return this;
        }

        public Builder withChannel(Radiometer radiometer, double... coefficients) {
            return withChannel(radiometer, CalibrationPolynomial.of(coefficients));
        }

        public CalibrationTable build() {
            return new CalibrationTable(channels);
        }
    }
}
