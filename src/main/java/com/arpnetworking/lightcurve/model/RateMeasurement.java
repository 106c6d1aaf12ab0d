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
 * A detected count rate with asymmetric errors.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class RateMeasurement extends Measurement {

    @Override
    public Kind getKind() {
        return Kind.DETECTION;
    }

    public double getRate() {
        return _rate;
    }

    @Override
    public double getRatePos() {
        return _ratePos;
    }

    @Override
    public double getRateNeg() {
        return _rateNeg;
    }

    /**
     * The signal to noise ratio of the rate, taken against the negative error.
     *
     * @return The signal to noise ratio; zero if the negative error is zero.
     */
    public double getSignalToNoise() {
        if (_rateNeg == 0) {
            return 0;
        }
        return _rate / Math.abs(_rateNeg);
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final RateMeasurement other = (RateMeasurement) object;

        return Double.compare(_rate, other._rate) == 0
                && Double.compare(_ratePos, other._ratePos) == 0
                && Double.compare(_rateNeg, other._rateNeg) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_rate, _ratePos, _rateNeg);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Rate", _rate)
                .add("RatePos", _ratePos)
                .add("RateNeg", _rateNeg)
                .toString();
    }

    private RateMeasurement(final Builder builder) {
        _rate = builder._rate;
        _ratePos = builder._ratePos;
        _rateNeg = builder._rateNeg;
    }

    private final double _rate;
    private final double _ratePos;
    private final double _rateNeg;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link RateMeasurement}.
     */
    public static final class Builder extends OvalBuilder<RateMeasurement> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(RateMeasurement::new);
        }

        /**
         * Set the rate. Required. Cannot be null.
         *
         * @param value The rate.
         * @return This {@link Builder} instance.
         */
        public Builder setRate(final Double value) {
            _rate = value;
            return this;
        }

        /**
         * Set the positive error. Required. Cannot be null or negative.
         *
         * @param value The positive error.
         * @return This {@link Builder} instance.
         */
        public Builder setRatePos(final Double value) {
            _ratePos = value;
            return this;
        }

        /**
         * Set the negative error. Required. Cannot be null or positive.
         *
         * @param value The negative error.
         * @return This {@link Builder} instance.
         */
        public Builder setRateNeg(final Double value) {
            _rateNeg = value;
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateRateNeg(final Double rateNeg) {
            return rateNeg <= 0;
        }

        @NotNull
        private Double _rate;
        @NotNull
        @NotNegative
        private Double _ratePos;
        @NotNull
        @ValidateWithMethod(methodName = "validateRateNeg", parameterType = Double.class)
        private Double _rateNeg;
    }
}
