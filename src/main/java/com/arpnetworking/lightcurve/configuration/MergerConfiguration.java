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
package com.arpnetworking.lightcurve.configuration;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.commons.jackson.databind.ObjectMapperFactory;
import com.arpnetworking.lightcurve.aggregation.BinClassifier;
import com.arpnetworking.lightcurve.model.Band;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Defaults applied by the mergers when a request leaves a parameter unset.
 * Confidence levels may be given as probabilities or as percentages and are
 * normalized to probabilities on build.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class MergerConfiguration {

    /**
     * Load a configuration from a JSON document.
     *
     * @param json The JSON document.
     * @return The {@link MergerConfiguration}.
     * @throws IOException if the document cannot be parsed.
     */
    public static MergerConfiguration fromJson(final String json) throws IOException {
        return OBJECT_MAPPER.readValue(json, Builder.class).build();
    }

    /**
     * Load a configuration from a JSON file.
     *
     * @param file The JSON file.
     * @return The {@link MergerConfiguration}.
     * @throws IOException if the file cannot be read or parsed.
     */
    public static MergerConfiguration fromFile(final File file) throws IOException {
        return OBJECT_MAPPER.readValue(file, Builder.class).build();
    }

    /**
     * The configuration with every parameter at its default.
     *
     * @return The default {@link MergerConfiguration}.
     */
    public static MergerConfiguration defaults() {
        return new Builder().build();
    }

    public double getUpperLimitConfidence() {
        return _upperLimitConfidence;
    }

    /**
     * The confidence level at which a detection is decided. Defaults to the
     * upper limit confidence.
     *
     * @return The detection threshold.
     */
    public double getDetectionThreshold() {
        return _detectionThreshold.orElse(_upperLimitConfidence);
    }

    public double getRateConfidence() {
        return _rateConfidence;
    }

    public ImmutableList<Band> getBands() {
        return _bands;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("UpperLimitConfidence", _upperLimitConfidence)
                .add("DetectionThreshold", _detectionThreshold)
                .add("RateConfidence", _rateConfidence)
                .add("Bands", _bands)
                .toString();
    }

    private MergerConfiguration(final Builder builder) {
        _upperLimitConfidence = ConfidenceLevels.normalize("upperLimitConfidence", builder._upperLimitConfidence);
        _detectionThreshold = Optional.ofNullable(builder._detectionThreshold)
                .map(value -> ConfidenceLevels.normalize("detectionThreshold", value));
        _rateConfidence = ConfidenceLevels.normalize("rateConfidence", builder._rateConfidence);
        _bands = builder._bands;
    }

    private final double _upperLimitConfidence;
    private final Optional<Double> _detectionThreshold;
    private final double _rateConfidence;
    private final ImmutableList<Band> _bands;

    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.getInstance();

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MergerConfiguration}.
     */
    public static final class Builder extends OvalBuilder<MergerConfiguration> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MergerConfiguration::new);
        }

        /**
         * Set the confidence level of upper limits. Optional. Cannot be null.
         * Defaults to 0.997.
         *
         * @param value The upper limit confidence.
         * @return This {@link Builder} instance.
         */
        public Builder setUpperLimitConfidence(final Double value) {
            _upperLimitConfidence = value;
            return this;
        }

        /**
         * Set the confidence level at which a detection is decided. Optional.
         * Can be null. Defaults to the upper limit confidence.
         *
         * @param value The detection threshold.
         * @return This {@link Builder} instance.
         */
        public Builder setDetectionThreshold(@Nullable final Double value) {
            _detectionThreshold = value;
            return this;
        }

        /**
         * Set the confidence level of the errors on detected rates. Optional.
         * Cannot be null. Defaults to one sigma.
         *
         * @param value The rate confidence.
         * @return This {@link Builder} instance.
         */
        public Builder setRateConfidence(final Double value) {
            _rateConfidence = value;
            return this;
        }

        /**
         * Set the bands merged when a request names none. Optional. Cannot be
         * null or empty. Defaults to every band.
         *
         * @param value The bands.
         * @return This {@link Builder} instance.
         */
        public Builder setBands(final List<Band> value) {
            _bands = ImmutableList.copyOf(value);
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateConfidence(final Double value) {
            return ConfidenceLevels.isValid(value);
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateBands(final List<?> bands) {
            return !bands.isEmpty();
        }

        @NotNull
        @ValidateWithMethod(methodName = "validateConfidence", parameterType = Double.class)
        private Double _upperLimitConfidence = DEFAULT_UPPER_LIMIT_CONFIDENCE;
        @Nullable
        @ValidateWithMethod(methodName = "validateConfidence", parameterType = Double.class)
        private Double _detectionThreshold;
        @NotNull
        @ValidateWithMethod(methodName = "validateConfidence", parameterType = Double.class)
        private Double _rateConfidence = BinClassifier.DEFAULT_RATE_CONFIDENCE;
        @NotNull
        @ValidateWithMethod(methodName = "validateBands", parameterType = List.class)
        private ImmutableList<Band> _bands = ImmutableList.copyOf(Band.values());

        private static final double DEFAULT_UPPER_LIMIT_CONFIDENCE = 0.997;
    }
}
