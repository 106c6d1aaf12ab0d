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
import com.arpnetworking.lightcurve.model.RowSelection;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import net.sf.oval.constraint.NotNull;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The parameters of one light curve merge. Confidence levels left unset
 * fall back to the {@link com.arpnetworking.lightcurve.configuration.MergerConfiguration}
 * of the merger.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class LightCurveMergeRequest {

    public RowSelection getSelection() {
        return _selection;
    }

    public boolean isRemove() {
        return _remove;
    }

    public InsertPolicy getInsertPolicy() {
        return _insertPolicy;
    }

    public boolean isForceRate() {
        return _forceRate;
    }

    public boolean isForceUpperLimit() {
        return _forceUpperLimit;
    }

    public Optional<Double> getUpperLimitConfidence() {
        return _upperLimitConfidence;
    }

    public Optional<Double> getDetectionThreshold() {
        return _detectionThreshold;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Selection", _selection)
                .add("Remove", _remove)
                .add("InsertPolicy", _insertPolicy)
                .add("ForceRate", _forceRate)
                .add("ForceUpperLimit", _forceUpperLimit)
                .add("UpperLimitConfidence", _upperLimitConfidence)
                .add("DetectionThreshold", _detectionThreshold)
                .toString();
    }

    private LightCurveMergeRequest(final Builder builder) {
        _selection = builder._selection;
        _remove = builder._remove;
        _insertPolicy = builder._insertPolicy;
        _forceRate = builder._forceRate;
        _forceUpperLimit = builder._forceUpperLimit;
        _upperLimitConfidence = Optional.ofNullable(builder._upperLimitConfidence);
        _detectionThreshold = Optional.ofNullable(builder._detectionThreshold);
    }

    private final RowSelection _selection;
    private final boolean _remove;
    private final InsertPolicy _insertPolicy;
    private final boolean _forceRate;
    private final boolean _forceUpperLimit;
    private final Optional<Double> _upperLimitConfidence;
    private final Optional<Double> _detectionThreshold;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link LightCurveMergeRequest}.
     */
    public static final class Builder extends OvalBuilder<LightCurveMergeRequest> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(LightCurveMergeRequest::new);
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
         * Set whether the merged rows are removed from the dataset. Optional.
         * Cannot be null. Defaults to false.
         *
         * @param value Whether to remove the merged rows.
         * @return This {@link Builder} instance.
         */
        public Builder setRemove(final Boolean value) {
            _remove = value;
            return this;
        }

        /**
         * Set the insert policy. Optional. Cannot be null. Defaults to
         * {@link InsertPolicy#NEVER_INSERT}.
         *
         * @param value The insert policy.
         * @return This {@link Builder} instance.
         */
        public Builder setInsertPolicy(final InsertPolicy value) {
            _insertPolicy = value;
            return this;
        }

        /**
         * Set whether a rate is reported regardless of significance. Optional.
         * Cannot be null. Defaults to false.
         *
         * @param value Whether to force a rate.
         * @return This {@link Builder} instance.
         */
        public Builder setForceRate(final Boolean value) {
            _forceRate = value;
            return this;
        }

        /**
         * Set whether an upper limit is reported regardless of significance.
         * Optional. Cannot be null. Defaults to false.
         *
         * @param value Whether to force an upper limit.
         * @return This {@link Builder} instance.
         */
        public Builder setForceUpperLimit(final Boolean value) {
            _forceUpperLimit = value;
            return this;
        }

        /**
         * Set the confidence level of a reported upper limit, as a probability
         * or a percentage. Optional. Can be null.
         *
         * @param value The upper limit confidence.
         * @return This {@link Builder} instance.
         */
        public Builder setUpperLimitConfidence(@Nullable final Double value) {
            _upperLimitConfidence = value;
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
        private Boolean _remove = false;
        @NotNull
        private InsertPolicy _insertPolicy = InsertPolicy.NEVER_INSERT;
        @NotNull
        private Boolean _forceRate = false;
        @NotNull
        private Boolean _forceUpperLimit = false;
        @Nullable
        private Double _upperLimitConfidence;
        @Nullable
        private Double _detectionThreshold;
    }
}
