package com.questrail.radiometer.model;

/**
 * Radiometer channel that acquired a spectrum.
 *
 * <p>Each channel is a separate detector with its own pixel-to-wavelength
 * calibration.</p>
 */
public enum Radiometer implements WireCoded
{
    /** Visible range detector. */
    VIS(0),

    /** Short-wave infrared detector. */
    SWIR(1),

    /** Near infrared detector. */
    NIR(2);

    private final int code;

    Radiometer(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }

    /**
     * Decodes a radiometer wire code.
     */
    public static CodedValue<Radiometer> fromCode(int code) {
        return CodedValue.of(Radiometer.class, code);
    }
}
