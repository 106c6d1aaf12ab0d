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
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link Bin} class and its measurements.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class BinTest {

    @Test
    public void interval() {
        final Bin bin = TestBeanFactory.createRateBinBuilder(100.0).setTimePos(4.0).setTimeNeg(6.0).build();
        Assert.assertEquals(94.0, bin.getStart(), 0.0);
        Assert.assertEquals(104.0, bin.getStop(), 0.0);
    }

    @Test
    public void kindFollowsMeasurement() {
        Assert.assertEquals(Kind.DETECTION, TestBeanFactory.createRateBin(1.0).getKind());
        Assert.assertEquals(Kind.UPPER_LIMIT, TestBeanFactory.createUpperLimitBin(1.0).getKind());
    }

    @Test
    public void upperLimitHasNoErrors() {
        final UpperLimitMeasurement upperLimit = TestBeanFactory.createUpperLimitMeasurement();
        Assert.assertEquals(0.0, upperLimit.getRatePos(), 0.0);
        Assert.assertEquals(0.0, upperLimit.getRateNeg(), 0.0);
        Assert.assertTrue(upperLimit.isUpperLimit());
    }

    @Test
    public void signalToNoise() {
        final RateMeasurement rate = new RateMeasurement.Builder()
                .setRate(4.0)
                .setRatePos(1.0)
                .setRateNeg(-0.5)
                .build();
        Assert.assertEquals(8.0, rate.getSignalToNoise(), 1e-12);
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void rejectsZeroExposure() {
        TestBeanFactory.createRateBinBuilder(1.0).setExposure(0.0).build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void rejectsNegativeCounts() {
        TestBeanFactory.createRateBinBuilder(1.0).setCountsInSource(-1L).build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void rejectsMissingMeasurement() {
        TestBeanFactory.createRateBinBuilder(1.0).setMeasurement(null).build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void rejectsPositiveRateNeg() {
        new RateMeasurement.Builder().setRate(1.0).setRatePos(0.1).setRateNeg(0.1).build();
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void rejectsZeroUpperLimit() {
        new UpperLimitMeasurement.Builder().setUpperLimit(0.0).build();
    }
}
