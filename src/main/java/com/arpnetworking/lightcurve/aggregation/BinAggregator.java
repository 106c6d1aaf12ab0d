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
package com.arpnetworking.lightcurve.aggregation;

import com.arpnetworking.lightcurve.model.Band;
import com.arpnetworking.lightcurve.model.Bin;
import com.arpnetworking.lightcurve.model.Countable;
import com.arpnetworking.lightcurve.model.Dataset;
import com.arpnetworking.lightcurve.model.MultiBandTable;
import com.arpnetworking.lightcurve.model.RowSelection;

import java.util.List;
import java.util.Optional;

/**
 * Sums the countable quantities of selected rows. No classification happens
 * here. This class is stateless and safe to share between threads.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class BinAggregator {

    /**
     * Aggregate the selected bins of a light curve dataset.
     *
     * @param dataset The dataset.
     * @param selection The rows to aggregate.
     * @return The {@link AggregatedBins}.
     * @throws com.arpnetworking.lightcurve.model.InconsistentSelectionException if a selected row is not in the dataset.
     */
    public AggregatedBins aggregate(final Dataset dataset, final RowSelection selection) {
        final List<Bin> bins = dataset.select(selection);
        final BinTotals totals = sum(bins);

        double start = Double.POSITIVE_INFINITY;
        double stop = Double.NEGATIVE_INFINITY;
        double timeSum = 0;
        boolean hasBackgroundRates = true;
        double backgroundRateSum = 0;
        double backgroundErrorSquareSum = 0;
        for (final Bin bin : bins) {
            start = Math.min(start, bin.getStart());
            stop = Math.max(stop, bin.getStop());
            timeSum += bin.getTime();
            if (bin.getBackgroundRate().isPresent()) {
                backgroundRateSum += bin.getBackgroundRate().get() * bin.getExposure();
                final double weightedError = bin.getBackgroundRateError().orElse(0.0) * bin.getExposure();
                backgroundErrorSquareSum += weightedError * weightedError;
            } else {
                hasBackgroundRates = false;
            }
        }
        final double time = Math.min(stop, Math.max(start, timeSum / bins.size()));

        Optional<Double> backgroundRate = Optional.empty();
        Optional<Double> backgroundRateError = Optional.empty();
        if (hasBackgroundRates) {
            backgroundRate = Optional.of(backgroundRateSum / totals.getExposure());
            backgroundRateError = Optional.of(Math.sqrt(backgroundErrorSquareSum) / totals.getExposure());
        }
        return new AggregatedBins(totals, time, stop - time, time - start, backgroundRate, backgroundRateError);
    }

    /**
     * Aggregate one band of the selected rows of a catalogue upper limit table.
     *
     * @param table The table.
     * @param band The band.
     * @param selection The rows to aggregate.
     * @return The {@link BinTotals} of the band.
     * @throws com.arpnetworking.lightcurve.model.InconsistentSelectionException if a selected row is not in the table.
     * @throws IllegalArgumentException if a selected row does not carry the band.
     */
    public BinTotals aggregate(final MultiBandTable table, final Band band, final RowSelection selection) {
        return sum(table.select(band, selection));
    }

    private static BinTotals sum(final List<? extends Countable> rows) {
        long counts = 0;
        double backgroundCounts = 0;
        double exposure = 0;
        double weightedCorrectionFactor = 0;
        for (final Countable row : rows) {
            counts = Math.addExact(counts, row.getCountsInSource());
            backgroundCounts += row.getBackgroundCounts();
            exposure += row.getExposure();
            weightedCorrectionFactor += row.getCorrectionFactor() * row.getExposure();
        }
        return new BinTotals(counts, backgroundCounts, exposure, weightedCorrectionFactor / exposure);
    }
}
