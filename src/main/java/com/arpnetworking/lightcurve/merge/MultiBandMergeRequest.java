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
package com.arpnetworking.lightcurve.merge;

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.lightcurve.model.Band;
import com.arpnetworking.lightcurve.model.RowSelection;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import net.sf.oval.constraint.NotNull;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The parameters of one multi-band upper limit merge. An empty band list
 * selects the bands of the {@link com.arpnetworking.lightcurve.configuration.MergerConfiguration};
 * unset confidence levels fall back to it as well.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class MultiBandMergeRequest {

    public RowSelection getSelection() {
        return _selection;
    }

    public boolean isDetectionsAsRates() {
        return _detectionsAsRates;
    }

    public ImmutableList<Band> getBands() {
        return _bands;
    }

    public Optional<Double> getConfidence() {
        return _confidence;
    }

    public Optional<Double> getDetectionThreshold() {
        return _detectionThreshold;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Selection", _selection)
                .add("DetectionsAsRates", _detectionsAsRates)
                .add("Bands", _bands)
                .add("Confidence", _confidence)
                .add("DetectionThreshold", _detectionThreshold)
                .toString();
    }

    private MultiBandMergeRequest(final Builder builder) {
        _selection = builder._selection;
        _detectionsAsRates = builder._detectionsAsRates;
        _bands = builder._bands;
        _confidence = Optional.ofNullable(builder._confidence);
        _detectionThreshold = Optional.ofNullable(builder._detectionThreshold);
    }

    private final RowSelection _selection;
    private final boolean _detectionsAsRates;
    private final ImmutableList<Band> _bands;
    private final Optional<Double> _confidence;
    private final Optional<Double> _detectionThreshold;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MultiBandMergeRequest}.
     */
    public static final class Builder extends OvalBuilder<MultiBandMergeRequest> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MultiBandMergeRequest::new);
        }

        /**
         * Set the rows to merge. Required. Cannot be null.
         *
         * @param value The selection.
         * @return This {@link Builder} instance.
         */
        public Builder setSelection(final RowSelection value) {
            _selection = value;
            return this;
        }

        /**
         * Set whether detected bands also report a rate. Optional. Cannot be
         * null. Defaults to true.
         *
         * @param value Whether to report detections as rates.
         * @return This {@link Builder} instance.
         */
        public Builder setDetectionsAsRates(final Boolean value) {
            _detectionsAsRates = value;
            return this;
        }

        /**
         * Set the bands to merge. Optional. Cannot be null. Defaults to empty,
         * which selects the configured bands.
         *
         * @param value The bands.
         * @return This {@link Builder} instance.
         */
        public Builder setBands(final List<Band> value) {
            _bands = ImmutableList.copyOf(value);
            return this;
        }

        /**
         * Set the bands to merge by name, ignoring case.
         *
         * @param value The band names, for example {@code soft}.
         * @return This {@link Builder} instance.
         * @throws IllegalArgumentException if a name is not a known band.
         */
        public Builder setBandNames(final Collection<String> value) {
            final ImmutableList.Builder<Band> bands = ImmutableList.builder();
            for (final String name : value) {
                bands.add(Band.fromName(name));
            }
            _bands = bands.build();
            return this;
        }

        /**
         * Set the confidence level of the upper limits, as a probability or a
         * percentage. Optional. Can be null.
         *
         * @param value The confidence.
         * @return This {@link Builder} instance.
         */
        public Builder setConfidence(@Nullable final Double value) {
            _confidence = value;
            return this;
        }

        /**
         * Set the confidence level at which a detection is decided, as a
         * probability or a percentage. Optional. Can be null. Defaults to the
         * upper limit confidence.
         *
         * @param value The detection threshold.
         * @return This {@link Builder} instance.
         */
        public Builder setDetectionThreshold(@Nullable final Double value) {
            _detectionThreshold = value;
            return this;
        }

        @NotNull
        private RowSelection _selection;
        @NotNull
        private Boolean _detectionsAsRates = true;
        @NotNull
        private ImmutableList<Band> _bands = ImmutableList.of();
        @Nullable
        private Double _confidence;
        @Nullable
        private Double _detectionThreshold;
    }
}
