/**
 * Default codec implementations for the spectrum chunk layout.
 *
 * <p>Netty {@code ByteBuf} provides the little-endian field accessors. Netty
 * types stay inside this package; the public surface is {@code byte[]},
 * {@code Chunk} and {@code SpectrumRecord}.</p>
 */
package com.questrail.radiometer.codec.impl;
