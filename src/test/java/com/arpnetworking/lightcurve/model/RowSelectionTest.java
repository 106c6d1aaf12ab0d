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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;

/**
 * Tests for the {@link RowSelection} class.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class RowSelectionTest {

    @Test
    public void sortsAndDeduplicates() {
        final RowSelection selection = RowSelection.of(4, 1, 4, 2);
        Assert.assertEquals(ImmutableSortedSet.of(1, 2, 4), selection.getIndices());
        Assert.assertEquals(3, selection.size());
        Assert.assertTrue(selection.contains(2));
        Assert.assertFalse(selection.contains(3));
    }

    @Test
    public void range() {
        Assert.assertEquals(RowSelection.of(ImmutableList.of(3, 4, 5)), RowSelection.range(3, 6));
    }

    @Test
    public void withinTable() {
        RowSelection.of(0, 9).checkWithin("PC", 10);
    }

    @Test
    public void outsideTable() {
        try {
            RowSelection.of(0, 10).checkWithin("PC", 10);
            Assert.fail("Expected exception");
        } catch (final InconsistentSelectionException e) {
            Assert.assertEquals(10, e.getRowCount());
            Assert.assertEquals(RowSelection.of(0, 10), e.getSelection());
            Assert.assertTrue(e.getMessage().contains("table=PC"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void empty() {
        RowSelection.of(Collections.emptyList());
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyVarargs() {
        RowSelection.of();
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyRange() {
        RowSelection.range(2, 2);
    }
}
