package com.questrail.radiometer.config;

import java.util.Objects;

/**
 * Configuration for {@code SequenceReader}.
 *
 * @param badRecordPolicy handling of chunks whose record fails to decode
 * @param strictEnumCodes reject unknown radiometer / optics codes as decode
 *                        failures instead of keeping them in the record
 */
public record SequenceReaderConfig(
    BadRecordPolicy badRecordPolicy,
    boolean strictEnumCodes
) {
    public SequenceReaderConfig {
        Objects.requireNonNull(badRecordPolicy, "badRecordPolicy");
    }

    /**
     * Fail fast on any bad record; keep unknown codes.
     */
    public static SequenceReaderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BadRecordPolicy badRecordPolicy = BadRecordPolicy.FAIL_FAST;
        private boolean strictEnumCodes = false;

        public Builder withBadRecordPolicy(BadRecordPolicy badRecordPolicy) {
            this.badRecordPolicy = badRecordPolicy;
            return this;
        }

        public Builder withStrictEnumCodes(boolean strictEnumCodes) {
            this.strictEnumCodes = strictEnumCodes;
            return this;
        }

        public SequenceReaderConfig build() {
            return new SequenceReaderConfig(badRecordPolicy, strictEnumCodes);
        }
    }
}
