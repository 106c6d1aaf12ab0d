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

import com.arpnetworking.lightcurve.aggregation.AggregatedBins;
import com.arpnetworking.lightcurve.aggregation.BinAggregator;
import com.arpnetworking.lightcurve.aggregation.BinClassifier;
import com.arpnetworking.lightcurve.configuration.ConfidenceLevels;
import com.arpnetworking.lightcurve.configuration.MergerConfiguration;
import com.arpnetworking.lightcurve.model.Bin;
import com.arpnetworking.lightcurve.model.Dataset;
import com.arpnetworking.lightcurve.model.Kind;
import com.arpnetworking.lightcurve.model.LightCurve;
import com.arpnetworking.lightcurve.model.Measurement;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * Merges selected bins of a light curve {@link Dataset} into one bin.
 *
 * <p>The selected bins are aggregated and classified as a detection or an
 * upper limit. Depending on the request the selected bins are then removed
 * and the merged bin inserted. Removal and insertion happen together after
 * classification has succeeded; a merge that fails leaves the dataset
 * unchanged. With {@link InsertPolicy#ALWAYS_COERCE} the merged bin is forced
 * to the kind of the dataset, so a dataset never holds bins of both kinds.
 *
 * <p>The merger itself is immutable; the dataset it is given is not, and
 * callers must not merge into the same dataset from more than one thread.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class LightCurveMerger {

    /**
     * Public constructor using the default configuration.
     */
    public LightCurveMerger() {
        this(MergerConfiguration.defaults());
    }

    /**
     * Public constructor.
     *
     * @param configuration The defaults for unset request parameters.
     */
    public LightCurveMerger(final MergerConfiguration configuration) {
        this(configuration, new BinAggregator(), new BinClassifier(configuration.getRateConfidence()));
    }

    LightCurveMerger(
            final MergerConfiguration configuration,
            final BinAggregator aggregator,
            final BinClassifier classifier) {
        _configuration = configuration;
        _aggregator = aggregator;
        _classifier = classifier;
    }

    /**
     * Merge bins of a named dataset of a light curve.
     *
     * @param lightCurve The light curve.
     * @param datasetName The name of the dataset, for example {@link LightCurve#PC_UPPER_LIMITS}.
     * @param request The merge parameters.
     * @return The {@link MergeResult}.
     * @throws IllegalArgumentException if the light curve has no such dataset or a parameter is invalid.
     * @throws com.arpnetworking.lightcurve.model.InconsistentSelectionException if a selected row is not in the dataset.
     */
    public MergeResult merge(final LightCurve lightCurve, final String datasetName, final LightCurveMergeRequest request) {
        final Optional<Dataset> dataset = lightCurve.getDataset(datasetName);
        if (!dataset.isPresent()) {
            throw new IllegalArgumentException(String.format(
                    "Invalid dataset name; name=%s, datasets=%s",
                    datasetName,
                    lightCurve.getDatasetNames()));
        }
        return merge(dataset.get(), request);
    }

    /**
     * Merge bins of a dataset.
     *
     * @param dataset The dataset.
     * @param request The merge parameters.
     * @return The {@link MergeResult}.
     * @throws IllegalArgumentException if a parameter is invalid.
     * @throws com.arpnetworking.lightcurve.model.InconsistentSelectionException if a selected row is not in the dataset.
     * @throws com.arpnetworking.lightcurve.statistics.ConvergenceException if the rate cannot be computed.
     */
    public MergeResult merge(final Dataset dataset, final LightCurveMergeRequest request) {
        Preconditions.checkArgument(
                !(request.isForceRate() && request.isForceUpperLimit()),
                "Invalid force flags; forceRate=%s, forceUpperLimit=%s, dataset=%s, selection=%s",
                request.isForceRate(),
                request.isForceUpperLimit(),
                dataset.getName(),
                request.getSelection().getIndices());
        final double upperLimitConfidence = ConfidenceLevels.normalize(
                "upperLimitConfidence",
                request.getUpperLimitConfidence().orElse(_configuration.getUpperLimitConfidence()));
        final double detectionThreshold = ConfidenceLevels.normalize(
                "detectionThreshold",
                request.getDetectionThreshold()
                        .orElse(request.getUpperLimitConfidence().isPresent()
                                ? upperLimitConfidence
                                : _configuration.getDetectionThreshold()));

        final AggregatedBins aggregated = _aggregator.aggregate(dataset, request.getSelection());

        boolean forceRate = request.isForceRate();
        boolean forceUpperLimit = request.isForceUpperLimit();
        if (request.getInsertPolicy() == InsertPolicy.ALWAYS_COERCE) {
            if (forceRate || forceUpperLimit) {
                LOGGER.warn()
                        .setMessage("Ignoring force flags; merged bin is coerced to the dataset kind")
                        .addData("dataset", dataset)
                        .addData("forceRate", forceRate)
                        .addData("forceUpperLimit", forceUpperLimit)
                        .log();
            }
            forceUpperLimit = dataset.getKind().isUpperLimit();
            forceRate = !forceUpperLimit;
        }

        final Measurement measurement = _classifier.classify(
                aggregated.getTotals(),
                detectionThreshold,
                upperLimitConfidence,
                forceRate,
                forceUpperLimit);
        final MergedBin mergedBin = new MergedBin(createBin(aggregated, measurement));
        LOGGER.debug()
                .setMessage("Classified merged bin")
                .addData("dataset", dataset)
                .addData("selection", request.getSelection())
                .addData("totals", aggregated.getTotals())
                .addData("kind", measurement.getKind())
                .log();

        final boolean insert = shouldInsert(request.getInsertPolicy(), dataset.getKind(), measurement.getKind());
        dataset.update(
                request.isRemove() ? Optional.of(request.getSelection()) : Optional.empty(),
                insert ? Optional.of(mergedBin.getBin()) : Optional.empty());
        if (request.isRemove() || insert) {
            LOGGER.debug()
                    .setMessage("Updated dataset")
                    .addData("dataset", dataset)
                    .addData("removed", request.isRemove() ? request.getSelection().size() : 0)
                    .addData("inserted", insert)
                    .log();
        }
        return new MergeResult(insert, mergedBin);
    }

    private static boolean shouldInsert(final InsertPolicy policy, final Kind datasetKind, final Kind mergedKind) {
        switch (policy) {
            case ALWAYS_COERCE:
                return true;
            case INSERT_IF_MATCHES:
                return datasetKind == mergedKind;
            case NEVER_INSERT:
                return false;
            default:
                throw new IllegalArgumentException(String.format("Unsupported insert policy; policy=%s", policy));
        }
    }

    private static Bin createBin(final AggregatedBins aggregated, final Measurement measurement) {
        return new Bin.Builder()
                .setTime(aggregated.getTime())
                .setTimePos(aggregated.getTimePos())
                .setTimeNeg(aggregated.getTimeNeg())
                .setCountsInSource(aggregated.getTotals().getCounts())
                .setBackgroundCounts(aggregated.getTotals().getBackgroundCounts())
                .setCorrectionFactor(aggregated.getTotals().getCorrectionFactor())
                .setExposure(aggregated.getTotals().getExposure())
                .setBackgroundRate(aggregated.getBackgroundRate().orElse(null))
                .setBackgroundRateError(aggregated.getBackgroundRateError().orElse(null))
                .setFractionalExposure(aggregated.getFractionalExposure())
                .setMeasurement(measurement)
                .build();
    }

    private final MergerConfiguration _configuration;
    private final BinAggregator _aggregator;
    private final BinClassifier _classifier;

    private static final Logger LOGGER = LoggerFactory.getLogger(LightCurveMerger.class);
}
