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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import net.sf.oval.constraint.NotNull;
import net.sf.oval.constraint.ValidateWithMethod;

import java.util.Map;
import java.util.Optional;

/**
 * A light curve: named {@link Dataset} instances, typically one rate dataset
 * and one upper limit dataset per instrument mode. The light curve is owned
 * by the caller; the mergers only mutate its datasets in place.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class LightCurve {

    /**
     * Get a dataset by name.
     *
     * @param name The name of the dataset.
     * @return The {@link Dataset}, if present.
     */
    public Optional<Dataset> getDataset(final String name) {
        return Optional.ofNullable(_datasets.get(name));
    }

    public ImmutableSet<String> getDatasetNames() {
        return _datasets.keySet();
    }

    public ImmutableMap<String, Dataset> getDatasets() {
        return _datasets;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("id", Integer.toHexString(System.identityHashCode(this)))
                .add("Datasets", _datasets.keySet())
                .toString();
    }

    private LightCurve(final Builder builder) {
        _datasets = ImmutableMap.copyOf(builder._datasets);
    }

    private final ImmutableMap<String, Dataset> _datasets;

    /**
     * Photon counting mode detections.
     */
    public static final String PC = "PC";
    /**
     * Photon counting mode upper limits.
     */
    public static final String PC_UPPER_LIMITS = "PCUL";
    /**
     * Windowed timing mode detections.
     */
    public static final String WT = "WT";
    /**
     * Windowed timing mode upper limits.
     */
    public static final String WT_UPPER_LIMITS = "WTUL";

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link LightCurve}.
     */
    public static final class Builder extends OvalBuilder<LightCurve> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(LightCurve::new);
        }

        /**
         * Set the datasets by name. Optional. Cannot be null. Defaults to no datasets.
         * Each key must be the name of its dataset.
         *
         * @param value The datasets.
         * @return This {@link Builder} instance.
         */
        public Builder setDatasets(final Map<String, Dataset> value) {
            _datasets = ImmutableMap.copyOf(value);
            return this;
        }

        /**
         * Add a dataset under its own name.
         *
         * @param value The dataset.
         * @return This {@link Builder} instance.
         */
        public Builder addDataset(final Dataset value) {
            _datasets = ImmutableMap.<String, Dataset>builder()
                    .putAll(_datasets)
                    .put(value.getName(), value)
                    .build();
            return this;
        }

        @SuppressFBWarnings(value = "UPM_UNCALLED_PRIVATE_METHOD", justification = "invoked reflectively by @ValidateWithMethod")
        private boolean validateDatasetNames(final ImmutableMap<String, Dataset> value) {
            for (final Map.Entry<String, Dataset> entry : value.entrySet()) {
                if (!entry.getKey().equals(entry.getValue().getName())) {
                    return false;
                }
            }
            return true;
        }

        @NotNull
        @ValidateWithMethod(methodName = "validateDatasetNames", parameterType = ImmutableMap.class)
        private ImmutableMap<String, Dataset> _datasets = ImmutableMap.of();
    }
}
