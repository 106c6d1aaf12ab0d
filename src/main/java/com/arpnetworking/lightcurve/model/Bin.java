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

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * One time indexed measurement of a light curve. The time interval of the
 * bin is {@code [time - timeNeg, time + timePos]}; both half widths are
 * non-negative.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class Bin implements Countable {

    public double getTime() {
        return _time;
    }

    public double getTimePos() {
        return _timePos;
    }

    public double getTimeNeg() {
        return _timeNeg;
    }

    public double getStart() {
        return _time - _timeNeg;
    }

    public double getStop() {
        return _time + _timePos;
    }

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

    public Optional<Double> getBackgroundRate() {
        return _backgroundRate;
    }

    public Optional<Double> getBackgroundRateError() {
        return _backgroundRateError;
    }

    public Optional<Double> getFractionalExposure() {
        return _fractionalExposure;
    }

    public Measurement getMeasurement() {
        return _measurement;
    }

    public Kind getKind() {
        return _measurement.getKind();
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final Bin other = (Bin) object;

        return Double.compare(_time, other._time) == 0
                && Double.compare(_timePos, other._timePos) == 0
                && Double.compare(_timeNeg, other._timeNeg) == 0
                && _countsInSource == other._countsInSource
                && Double.compare(_backgroundCounts, other._backgroundCounts) == 0
                && Double.compare(_correctionFactor, other._correctionFactor) == 0
                && Double.compare(_exposure, other._exposure) == 0
                && Objects.equal(_backgroundRate, other._backgroundRate)
                && Objects.equal(_backgroundRateError, other._backgroundRateError)
                && Objects.equal(_fractionalExposure, other._fractionalExposure)
                && Objects.equal(_measurement, other._measurement);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(
                _time,
                _timePos,
                _timeNeg,
                _countsInSource,
                _backgroundCounts,
                _correctionFactor,
                _exposure,
                _backgroundRate,
                _backgroundRateError,
                _fractionalExposure,
                _measurement);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Time", _time)
                .add("TimePos", _timePos)
                .add("TimeNeg", _timeNeg)
                .add("CountsInSource", _countsInSource)
                .add("BackgroundCounts", _backgroundCounts)
                .add("CorrectionFactor", _correctionFactor)
                .add("Exposure", _exposure)
                .add("BackgroundRate", _backgroundRate)
                .add("BackgroundRateError", _backgroundRateError)
                .add("FractionalExposure", _fractionalExposure)
                .add("Measurement", _measurement)
                .toString();
    }

    private Bin(final Builder builder) {
        _time = builder._time;
        _timePos = builder._timePos;
        _timeNeg = builder._timeNeg;
        _countsInSource = builder._countsInSource;
        _backgroundCounts = builder._backgroundCounts;
        _correctionFactor = builder._correctionFactor;
        _exposure = builder._exposure;
        _backgroundRate = Optional.ofNullable(builder._backgroundRate);
        _backgroundRateError = Optional.ofNullable(builder._backgroundRateError);
        _fractionalExposure = Optional.ofNullable(builder._fractionalExposure);
        _measurement = builder._measurement;
    }

    private final double _time;
    private final double _timePos;
    private final double _timeNeg;
    private final long _countsInSource;
    private final double _backgroundCounts;
    private final double _correctionFactor;
    private final double _exposure;
    private final Optional<Double> _backgroundRate;
    private final Optional<Double> _backgroundRateError;
    private final Optional<Double> _fractionalExposure;
    private final Measurement _measurement;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link Bin}.
     */
    public static final class Builder extends OvalBuilder<Bin> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(Bin::new);
        }

        /**
         * Set the time of the bin centre. Required. Cannot be null.
         *
         * @param value The time.
         * @return This {@link Builder} instance.
         */
        public Builder setTime(final Double value) {
            _time = value;
            return this;
        }

        /**
         * Set the half width after the bin centre. Required. Cannot be null or negative.
         *
         * @param value The positive half width.
         * @return This {@link Builder} instance.
         */
        public Builder setTimePos(final Double value) {
            _timePos = value;
            return this;
        }

        /**
         * Set the half width before the bin centre. Required. Cannot be null or negative.
         *
         * @param value The negative half width, as a magnitude.
         * @return This {@link Builder} instance.
         */
        public Builder setTimeNeg(final Double value) {
            _timeNeg = value;
            return this;
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
         * Set the expected background counts in the source region. Required.
         * Cannot be null or negative.
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

        /**
         * Set the background count rate. Optional. Can be null.
         *
         * @param value The background rate.
         * @return This {@link Builder} instance.
         */
        public Builder setBackgroundRate(@Nullable final Double value) {
            _backgroundRate = value;
            return this;
        }

        /**
         * Set the error on the background count rate. Optional. Can be null.
         *
         * @param value The background rate error.
         * @return This {@link Builder} instance.
         */
        public Builder setBackgroundRateError(@Nullable final Double value) {
            _backgroundRateError = value;
            return this;
        }

        /**
         * Set the fraction of the bin duration that was exposed. Optional. Can be null.
         *
         * @param value The fractional exposure.
         * @return This {@link Builder} instance.
         */
        public Builder setFractionalExposure(@Nullable final Double value) {
            _fractionalExposure = value;
            return this;
        }

        /**
         * Set the measurement. Required. Cannot be null.
         *
         * @param value The measurement.
         * @return This {@link Builder} instance.
         */
        public Builder setMeasurement(final Measurement value) {
            _measurement = value;
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validatePositive(final Double value) {
            return value > 0;
        }

        @NotNull
        private Double _time;
        @NotNull
        @NotNegative
        private Double _timePos;
        @NotNull
        @NotNegative
        private Double _timeNeg;
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
        @Nullable
        private Double _backgroundRate;
        @Nullable
        @NotNegative
        private Double _backgroundRateError;
        @Nullable
        @NotNegative
        private Double _fractionalExposure;
        @NotNull
        private Measurement _measurement;
    }
}
