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

import com.arpnetworking.lightcurve.test.TestBeanFactory;
import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link MultiBandTable} and {@link Band} classes.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class MultiBandTableTest {

    @Test
    public void bandPresenceDependsOnSelectedRowsOnly() {
        final BandColumns columns = TestBeanFactory.createBandColumns(1, 0.1);
        final MultiBandTable table = new MultiBandTable(
                "catalogue",
                ImmutableList.of(
                        TestBeanFactory.createMultiBandRow(columns, Band.MEDIUM),
                        TestBeanFactory.createMultiBandRow(columns, Band.HARD)));
        Assert.assertTrue(table.hasBand(Band.MEDIUM, RowSelection.of(0)));
        Assert.assertFalse(table.hasBand(Band.MEDIUM, RowSelection.of(0, 1)));
        Assert.assertTrue(table.hasBand(Band.HARD, RowSelection.of(1)));
        Assert.assertFalse(table.hasBand(Band.SOFT, RowSelection.of(0)));
        Assert.assertEquals(ImmutableList.of(columns), table.select(Band.MEDIUM, RowSelection.of(0)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void selectBandMissingFromSelectedRow() {
        final BandColumns columns = TestBeanFactory.createBandColumns(1, 0.1);
        final MultiBandTable table = new MultiBandTable(
                "catalogue",
                ImmutableList.of(
                        TestBeanFactory.createMultiBandRow(columns, Band.MEDIUM),
                        TestBeanFactory.createMultiBandRow(columns, Band.HARD)));
        table.select(Band.MEDIUM, RowSelection.of(0, 1));
    }

    @Test(expected = InconsistentSelectionException.class)
    public void hasBandOutsideTable() {
        final MultiBandTable table = new MultiBandTable(
                "catalogue",
                ImmutableList.of(TestBeanFactory.createMultiBandRow(TestBeanFactory.createBandColumns(1, 0.1), Band.TOTAL)));
        table.hasBand(Band.TOTAL, RowSelection.of(3));
    }

    @Test
    public void selectBand() {
        final BandColumns first = TestBeanFactory.createBandColumns(1, 0.1);
        final BandColumns second = TestBeanFactory.createBandColumns(2, 0.2);
        final MultiBandTable table = new MultiBandTable(
                "catalogue",
                ImmutableList.of(
                        TestBeanFactory.createMultiBandRow(first, Band.MEDIUM),
                        TestBeanFactory.createMultiBandRow(second, Band.MEDIUM)));
        Assert.assertEquals(ImmutableList.of(second), table.select(Band.MEDIUM, RowSelection.of(1)));
    }

    @Test(expected = InconsistentSelectionException.class)
    public void selectOutsideTable() {
        final MultiBandTable table = new MultiBandTable(
                "catalogue",
                ImmutableList.of(TestBeanFactory.createMultiBandRow(TestBeanFactory.createBandColumns(1, 0.1), Band.TOTAL)));
        table.select(Band.TOTAL, RowSelection.of(1));
    }

    @Test
    public void bandNamesIgnoreCase() {
        Assert.assertEquals(Band.SOFT, Band.fromName("soft"));
        Assert.assertEquals(Band.HARD, Band.fromName("HARD"));
        Assert.assertEquals(Band.TOTAL, Band.fromName("Total"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownBandName() {
        Band.fromName("ultraviolet");
    }
}
