package com.questrail.radiometer.model;

import java.util.Objects;
import java.util.Optional;

/**
 * CodedValue
 * =============================================================================
 * Closed representation of an enum-like header field decoded from a small
 * integer wire code.
 *
 * <p>A code either maps to a constant of the field's enum ({@link Known}) or it
 * does not ({@link Unknown}). Unrecognised codes are kept, together with the raw
 * value, so that callers can decide whether to degrade gracefully or reject the
 * record. There is no silent default constant.</p>
 *
 * <pre>
 *   if (value instanceof CodedValue.Known&lt;Radiometer&gt; known) {
 *       ... known.value() ...
 *   } else {
 *       ... ((CodedValue.Unknown&lt;Radiometer&gt;) value).code() ...
 *   }
 * </pre>
 *
 * @param <E> the enum type of the field
 */
public sealed interface CodedValue<E extends Enum<E> & WireCoded>
        permits CodedValue.Known, CodedValue.Unknown
{
    /**
     * Returns the raw wire code.
     */
    int code();

    /**
     * Returns the display name: the enum constant name, or {@code UNKNOWN(code)}.
     */
    String displayName();

    /**
     * Returns the enum constant, if the code is recognised.
     */
    Optional<E> known();

    /**
     * Maps a wire code onto {@code type}'s constants.
     *
     * @param type enum type of the field
     * @param code raw wire code
     * @return a {@link Known} value if some constant carries {@code code},
     *         otherwise an {@link Unknown} value carrying the raw code
     */
    static <E extends Enum<E> & WireCoded> CodedValue<E> of(Class<E> type, int code)
    {
        Objects.requireNonNull(type, "type");
        for (E constant : type.getEnumConstants()) {
            if (constant.code() == code) {
                return new Known<>(constant);
            }
        }
        return new Unknown<>(type, code);
    }

    /**
     * A wire code that maps to an enum constant.
     */
    record Known<E extends Enum<E> & WireCoded>(E value) implements CodedValue<E>
    {
        public Known {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public int code() {
            return value.code();
        }

        @Override
        public String displayName() {
            return value.name();
        }

        @Override
        public Optional<E> known() {
            return Optional.of(value);
        }
    }

    /**
     * A wire code with no matching enum constant.
     */
    record Unknown<E extends Enum<E> & WireCoded>(Class<E> type, int code) implements CodedValue<E>
    {
        public Unknown {
            Objects.requireNonNull(type, "type");
        }

        @Override
        public String displayName() {
            return "UNKNOWN(" + code + ")";
        }

        @Override
        public Optional<E> known() {
            return Optional.empty();
        }
    }
}
