package com.questrail.radiometer.model;

import java.util.Objects;

/**
 * Which radiometer channel and which entrance optics produced a spectrum.
 */
public record SpectrumType(
        CodedValue<Radiometer> radiometer,
        CodedValue<Optics> optics
)
{
    public SpectrumType {
        Objects.requireNonNull(radiometer, "radiometer");
        Objects.requireNonNull(optics, "optics");
    }

    public static SpectrumType of(Radiometer radiometer, Optics optics) {
        return new SpectrumType(
                new CodedValue.Known<>(Objects.requireNonNull(radiometer, "radiometer")),
                new CodedValue.Known<>(Objects.requireNonNull(optics, "optics")));
    }

    /**
     * Returns true when both codes map to known constants.
     */
    public boolean isFullyKnown() {
        return radiometer.known().isPresent() && optics.known().isPresent();
    }
}
