package com.questrail.radiometer.model;

/**
 * Implemented by enums whose constants are identified on the wire by a small
 * integer code.
 */
public interface WireCoded
{
    /**
     * Returns the code that identifies this constant on the wire.
     */
    int code();
}
