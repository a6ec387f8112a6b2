package com.questrail.radiometer.model;

/**
 * Entrance optics in front of the radiometer when a spectrum was acquired.
 */
public enum Optics implements WireCoded
{
    /** Narrow field-of-view fore-optics (radiance). */
    DIRECT(0),

    /** Cosine corrector (irradiance). */
    COSINE(1);

    private final int code;

    Optics(int code) {
        this.code = code;
    }

    @Override
    public int code() {
        return code;
    }

    /**
     * Decodes an optics wire code.
     */
    public static CodedValue<Optics> fromCode(int code) {
        return CodedValue.of(Optics.class, code);
    }
}
