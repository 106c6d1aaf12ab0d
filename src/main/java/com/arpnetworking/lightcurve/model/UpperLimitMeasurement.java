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
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

/**
 * An upper limit on the count rate. Upper limits carry no error bars.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class UpperLimitMeasurement extends Measurement {

    @Override
    public Kind getKind() {
        return Kind.UPPER_LIMIT;
    }

    public double getUpperLimit() {
        return _upperLimit;
    }

    @Override
    public double getRatePos() {
        return 0;
    }

    @Override
    public double getRateNeg() {
        return 0;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final UpperLimitMeasurement other = (UpperLimitMeasurement) object;

        return Double.compare(_upperLimit, other._upperLimit) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_upperLimit);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("UpperLimit", _upperLimit)
                .toString();
    }

    private UpperLimitMeasurement(final Builder builder) {
        _upperLimit = builder._upperLimit;
    }

    private final double _upperLimit;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link UpperLimitMeasurement}.
     */
    public static final class Builder extends OvalBuilder<UpperLimitMeasurement> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(UpperLimitMeasurement::new);
        }

        /**
         * Set the upper limit. Required. Must be positive.
         *
         * @param value The upper limit.
         * @return This {@link Builder} instance.
         */
        public Builder setUpperLimit(final Double value) {
            _upperLimit = value;
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateUpperLimit(final Double upperLimit) {
            return upperLimit > 0;
        }

        @NotNull
        @ValidateWithMethod(methodName = "validateUpperLimit", parameterType = Double.class)
        private Double _upperLimit;
    }
}
