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
package com.arpnetworking.lightcurve.statistics;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link GammaFunctions} class.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public class GammaFunctionsTest {

    @Test
    public void lnGammaOfIntegers() {
        Assert.assertEquals(0.0, GammaFunctions.lnGamma(1.0), 1e-9);
        Assert.assertEquals(0.0, GammaFunctions.lnGamma(2.0), 1e-9);
        Assert.assertEquals(Math.log(3628800.0), GammaFunctions.lnGamma(11.0), 1e-9);
    }

    @Test
    public void lnGammaOfHalf() {
        Assert.assertEquals(0.5 * Math.log(Math.PI), GammaFunctions.lnGamma(0.5), 1e-9);
    }

    @Test
    public void upperOfUnitShapeIsExponential() {
        // Series branch.
        Assert.assertEquals(-0.5, GammaFunctions.logRegularizedUpper(1.0, 0.5), 1e-12);
        // Continued fraction branch.
        Assert.assertEquals(-5.0, GammaFunctions.logRegularizedUpper(1.0, 5.0), 1e-12);
        Assert.assertEquals(-700.0, GammaFunctions.logRegularizedUpper(1.0, 700.0), 1e-9);
    }

    @Test
    public void upperOfIntegerShapeIsPoissonCumulative() {
        // Q(3, 2) = exp(-2) * (1 + 2 + 2)
        Assert.assertEquals(Math.log(5.0) - 2.0, GammaFunctions.logRegularizedUpper(3.0, 2.0), 1e-10);
        // Q(3, 6) = exp(-6) * (1 + 6 + 18)
        Assert.assertEquals(Math.log(25.0) - 6.0, GammaFunctions.logRegularizedUpper(3.0, 6.0), 1e-10);
    }

    @Test
    public void upperAtZeroIsOne() {
        Assert.assertEquals(0.0, GammaFunctions.logRegularizedUpper(4.0, 0.0), 0.0);
    }

    @Test
    public void upperDoesNotUnderflow() {
        final double logQ = GammaFunctions.logRegularizedUpper(6.0, 10_000.0);
        Assert.assertTrue(Double.isFinite(logQ));
        Assert.assertTrue(logQ < -9000.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void lnGammaOfZero() {
        GammaFunctions.lnGamma(0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void upperOfNegativeLimit() {
        GammaFunctions.logRegularizedUpper(1.0, -1.0);
    }
}
