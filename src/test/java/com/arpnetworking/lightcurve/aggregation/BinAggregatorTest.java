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
import com.arpnetworking.lightcurve.model.Dataset;
import com.arpnetworking.lightcurve.model.InconsistentSelectionException;
import com.arpnetworking.lightcurve.model.Kind;
import com.arpnetworking.lightcurve.model.MultiBandTable;
import com.arpnetworking.lightcurve.model.RowSelection;
import com.arpnetworking.lightcurve.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link BinAggregator} class.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class BinAggregatorTest {

    @Test
    public void sumsCountsAndExposure() {
        final Dataset dataset = new Dataset(
                "PC",
                Kind.DETECTION,
                ImmutableList.of(
                        TestBeanFactory.createRateBinBuilder(5.0).setCountsInSource(17L).setExposure(9.5).build(),
                        TestBeanFactory.createRateBinBuilder(15.0).setCountsInSource(4L).setExposure(3.25).build(),
                        TestBeanFactory.createRateBinBuilder(25.0).setCountsInSource(1_000_000_001L).setExposure(0.125).build()));

        final BinTotals totals = AGGREGATOR.aggregate(dataset, RowSelection.range(0, 3)).getTotals();
        Assert.assertEquals(1_000_000_022L, totals.getCounts());
        Assert.assertEquals(12.875, totals.getExposure(), 0.0);
        Assert.assertEquals(3.0, totals.getBackgroundCounts(), 1e-12);
    }

    @Test
    public void weightsCorrectionFactorByExposure() {
        final Dataset dataset = new Dataset(
                "PC",
                Kind.DETECTION,
                ImmutableList.of(
                        TestBeanFactory.createRateBinBuilder(5.0).setCorrectionFactor(1.0).setExposure(10.0).build(),
                        TestBeanFactory.createRateBinBuilder(15.0).setCorrectionFactor(2.0).setExposure(30.0).build()));

        final BinTotals totals = AGGREGATOR.aggregate(dataset, RowSelection.of(0, 1)).getTotals();
        Assert.assertEquals(1.75, totals.getCorrectionFactor(), 1e-12);
        Assert.assertEquals(40.0, totals.getExposure(), 0.0);
    }

    @Test
    public void spansSelectedTimes() {
        final Dataset dataset = TestBeanFactory.createDataset("PC", Kind.DETECTION, 4);

        // Bins at 5, 15, 25 and 35, each five seconds either side.
        final AggregatedBins aggregated = AGGREGATOR.aggregate(dataset, RowSelection.of(0, 2));
        Assert.assertEquals(15.0, aggregated.getTime(), 1e-12);
        Assert.assertEquals(15.0, aggregated.getTimePos(), 1e-12);
        Assert.assertEquals(15.0, aggregated.getTimeNeg(), 1e-12);
        Assert.assertEquals(20.0 / 30.0, aggregated.getFractionalExposure(), 1e-12);
    }

    @Test
    public void meanTimeIsNotCentre() {
        final Dataset dataset = new Dataset(
                "PC",
                Kind.DETECTION,
                ImmutableList.of(
                        TestBeanFactory.createRateBinBuilder(5.0).build(),
                        TestBeanFactory.createRateBinBuilder(10.0).setTimePos(20.0).setTimeNeg(1.0).build()));

        final AggregatedBins aggregated = AGGREGATOR.aggregate(dataset, RowSelection.of(0, 1));
        Assert.assertEquals(7.5, aggregated.getTime(), 1e-12);
        Assert.assertEquals(22.5, aggregated.getTimePos(), 1e-12);
        Assert.assertEquals(7.5, aggregated.getTimeNeg(), 1e-12);
    }

    @Test
    public void singleBinKeepsItsInterval() {
        final Bin bin = TestBeanFactory.createRateBinBuilder(42.0).setTimePos(3.0).setTimeNeg(2.0).build();
        final Dataset dataset = new Dataset("PC", Kind.DETECTION, ImmutableList.of(bin));

        final AggregatedBins aggregated = AGGREGATOR.aggregate(dataset, RowSelection.of(0));
        Assert.assertEquals(42.0, aggregated.getTime(), 0.0);
        Assert.assertEquals(3.0, aggregated.getTimePos(), 0.0);
        Assert.assertEquals(2.0, aggregated.getTimeNeg(), 0.0);
        Assert.assertEquals(bin.getCountsInSource(), aggregated.getTotals().getCounts());
    }

    @Test
    public void weightsBackgroundRateByExposure() {
        final Dataset dataset = new Dataset(
                "PC",
                Kind.DETECTION,
                ImmutableList.of(
                        TestBeanFactory.createRateBinBuilder(5.0)
                                .setExposure(10.0)
                                .setBackgroundRate(0.1)
                                .setBackgroundRateError(0.01)
                                .build(),
                        TestBeanFactory.createRateBinBuilder(15.0)
                                .setExposure(30.0)
                                .setBackgroundRate(0.3)
                                .setBackgroundRateError(0.02)
                                .build()));

        final AggregatedBins aggregated = AGGREGATOR.aggregate(dataset, RowSelection.of(0, 1));
        Assert.assertEquals(0.25, aggregated.getBackgroundRate().get(), 1e-12);
        Assert.assertEquals(Math.sqrt(0.37) / 40.0, aggregated.getBackgroundRateError().get(), 1e-12);
    }

    @Test
    public void omitsBackgroundRateUnlessEveryBinHasOne() {
        final Dataset dataset = new Dataset(
                "PC",
                Kind.DETECTION,
                ImmutableList.of(
                        TestBeanFactory.createRateBinBuilder(5.0).setBackgroundRate(0.1).build(),
                        TestBeanFactory.createRateBinBuilder(15.0).build()));

        final AggregatedBins aggregated = AGGREGATOR.aggregate(dataset, RowSelection.of(0, 1));
        Assert.assertFalse(aggregated.getBackgroundRate().isPresent());
        Assert.assertFalse(aggregated.getBackgroundRateError().isPresent());
    }

    @Test
    public void aggregatesOneBand() {
        final MultiBandTable table = new MultiBandTable(
                "catalogue",
                ImmutableList.of(
                        TestBeanFactory.createMultiBandRow(TestBeanFactory.createBandColumns(3, 0.5), Band.TOTAL, Band.SOFT),
                        TestBeanFactory.createMultiBandRow(TestBeanFactory.createBandColumns(4, 0.25), Band.TOTAL, Band.SOFT)));

        final BinTotals totals = AGGREGATOR.aggregate(table, Band.SOFT, RowSelection.of(0, 1));
        Assert.assertEquals(7L, totals.getCounts());
        Assert.assertEquals(0.75, totals.getBackgroundCounts(), 0.0);
        Assert.assertEquals(200.0, totals.getExposure(), 0.0);
        Assert.assertEquals(1.0, totals.getCorrectionFactor(), 1e-12);
    }

    @Test(expected = InconsistentSelectionException.class)
    public void selectionOutsideDataset() {
        AGGREGATOR.aggregate(TestBeanFactory.createDataset("PC", Kind.DETECTION, 3), RowSelection.of(1, 3));
    }

    @Test(expected = InconsistentSelectionException.class)
    public void negativeSelection() {
        AGGREGATOR.aggregate(TestBeanFactory.createDataset("PC", Kind.DETECTION, 3), RowSelection.of(-1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void bandAbsentFromTable() {
        final MultiBandTable table = new MultiBandTable(
                "catalogue",
                ImmutableList.of(TestBeanFactory.createMultiBandRow(TestBeanFactory.createBandColumns(3, 0.5), Band.TOTAL)));
        AGGREGATOR.aggregate(table, Band.HARD, RowSelection.of(0));
    }

    private static final BinAggregator AGGREGATOR = new BinAggregator();
}
