/*
 * Copyright 2026 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.lightcurve.model;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotNegative;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

/**
 * The countable quantities of one energy band in one {@link MultiBandRow}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class BandColumns implements Countable {

    @Override
    public long getCountsInSource() {
        return _countsInSource;
    }

    @Override
    public double getBackgroundCounts() {
        return _backgroundCounts;
    }

    @Override
    public double getCorrectionFactor() {
        return _correctionFactor;
    }

    @Override
    public double getExposure() {
        return _exposure;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final BandColumns other = (BandColumns) object;

        return _countsInSource == other._countsInSource
                && Double.compare(_backgroundCounts, other._backgroundCounts) == 0
                && Double.compare(_correctionFactor, other._correctionFactor) == 0
                && Double.compare(_exposure, other._exposure) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_countsInSource, _backgroundCounts, _correctionFactor, _exposure);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("CountsInSource", _countsInSource)
                .add("BackgroundCounts", _backgroundCounts)
                .add("CorrectionFactor", _correctionFactor)
                .add("Exposure", _exposure)
                .toString();
    }

    private BandColumns(final Builder builder) {
        _countsInSource = builder._countsInSource;
        _backgroundCounts = builder._backgroundCounts;
        _correctionFactor = builder._correctionFactor;
        _exposure = builder._exposure;
    }

    private final long _countsInSource;
    private final double _backgroundCounts;
    private final double _correctionFactor;
    private final double _exposure;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link BandColumns}.
     */
    public static final class Builder extends OvalBuilder<BandColumns> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(BandColumns::new);
        }

        /**
         * Set the counts in the source region. Required. Cannot be null or negative.
         *
         * @param value The counts.
         * @return This {@link Builder} instance.
         */
        public Builder setCountsInSource(final Long value) {
            _countsInSource = value;
            return this;
        }

        /**
         * Set the expected background counts. Required. Cannot be null or negative.
         *
         * @param value The background counts.
         * @return This {@link Builder} instance.
         */
        public Builder setBackgroundCounts(final Double value) {
            _backgroundCounts = value;
            return this;
        }

        /**
         * Set the correction factor. Required. Must be positive.
         *
         * @param value The correction factor.
         * @return This {@link Builder} instance.
         */
        public Builder setCorrectionFactor(final Double value) {
            _correctionFactor = value;
            return this;
        }

        /**
         * Set the exposure in seconds. Required. Must be positive.
         *
         * @param value The exposure.
         * @return This {@link Builder} instance.
         */
        public Builder setExposure(final Double value) {
            _exposure = value;
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validatePositive(final Double value) {
            return value > 0;
        }

        @NotNull
        @NotNegative
        private Long _countsInSource;
        @NotNull
        @NotNegative
        private Double _backgroundCounts;
        @NotNull
        @ValidateWithMethod(methodName = "validatePositive", parameterType = Double.class)
        private Double _correctionFactor;
        @NotNull
        @ValidateWithMethod(methodName = "validatePositive", parameterType = Double.class)
        private Double _exposure;
    }
}
