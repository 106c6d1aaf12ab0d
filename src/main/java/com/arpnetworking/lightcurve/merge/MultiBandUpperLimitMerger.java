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

import com.arpnetworking.lightcurve.aggregation.BinAggregator;
import com.arpnetworking.lightcurve.aggregation.BinClassifier;
import com.arpnetworking.lightcurve.aggregation.BinTotals;
import com.arpnetworking.lightcurve.configuration.ConfidenceLevels;
import com.arpnetworking.lightcurve.configuration.MergerConfiguration;
import com.arpnetworking.lightcurve.model.Band;
import com.arpnetworking.lightcurve.model.MultiBandTable;
import com.arpnetworking.steno.Logger;
import com.arpnetworking.steno.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * Merges the selected rows of a catalogue upper limit table independently
 * in each energy band. Every merged band reports an upper limit; when
 * requested, bands whose lower bound exceeds zero also report a rate.
 * Requested bands that any selected row does not carry are skipped.
 *
 * <p>The table is never modified.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public final class MultiBandUpperLimitMerger {

    /**
     * Public constructor using the default configuration.
     */
    public MultiBandUpperLimitMerger() {
        this(MergerConfiguration.defaults());
    }

    /**
     * Public constructor.
     *
     * @param configuration The defaults for unset request parameters.
     */
    public MultiBandUpperLimitMerger(final MergerConfiguration configuration) {
        this(configuration, new BinAggregator(), new BinClassifier(configuration.getRateConfidence()));
    }

    MultiBandUpperLimitMerger(
            final MergerConfiguration configuration,
            final BinAggregator aggregator,
            final BinClassifier classifier) {
        _configuration = configuration;
        _aggregator = aggregator;
        _classifier = classifier;
    }

    /**
     * Merge the selected rows of a table in each requested band.
     *
     * @param table The table.
     * @param request The merge parameters.
     * @return The {@link MultiBandMergeResult}.
     * @throws IllegalArgumentException if a confidence level is invalid.
     * @throws com.arpnetworking.lightcurve.model.InconsistentSelectionException if a selected row is not in the table.
     * @throws com.arpnetworking.lightcurve.statistics.ConvergenceException if a limit cannot be computed.
     */
    public MultiBandMergeResult merge(final MultiBandTable table, final MultiBandMergeRequest request) {
        final double confidence = ConfidenceLevels.normalize(
                "confidence",
                request.getConfidence().orElse(_configuration.getUpperLimitConfidence()));
        final double detectionThreshold = ConfidenceLevels.normalize(
                "detectionThreshold",
                request.getDetectionThreshold()
                        .orElse(request.getConfidence().isPresent()
                                ? confidence
                                : _configuration.getDetectionThreshold()));
        request.getSelection().checkWithin(table.getName(), table.size());

        final ImmutableList<Band> bands = request.getBands().isEmpty() ? _configuration.getBands() : request.getBands();
        final ImmutableMap.Builder<Band, BandMergeResult> results = ImmutableMap.builder();
        for (final Band band : bands) {
            if (!table.hasBand(band, request.getSelection())) {
                LOGGER.debug()
                        .setMessage("Skipping band absent from selected rows")
                        .addData("table", table)
                        .addData("band", band)
                        .addData("selection", request.getSelection())
                        .log();
                continue;
            }
            final BinTotals totals = _aggregator.aggregate(table, band, request.getSelection());
            Optional<BandDetection> detection = Optional.empty();
            if (request.isDetectionsAsRates()) {
                detection = Optional.of(
                        _classifier.isDetected(totals, detectionThreshold)
                                ? BandDetection.detected(_classifier.rate(totals))
                                : BandDetection.notDetected());
            }
            final double upperLimit = _classifier.upperLimit(totals, confidence).getUpperLimit();
            LOGGER.debug()
                    .setMessage("Merged band")
                    .addData("table", table)
                    .addData("band", band)
                    .addData("selection", request.getSelection())
                    .addData("totals", totals)
                    .addData("upperLimit", upperLimit)
                    .log();
            results.put(band, new BandMergeResult(band, upperLimit, totals, detection));
        }
        return new MultiBandMergeResult(results.buildKeepingLast());
    }

    private final MergerConfiguration _configuration;
    private final BinAggregator _aggregator;
    private final BinClassifier _classifier;

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiBandUpperLimitMerger.class);
}
