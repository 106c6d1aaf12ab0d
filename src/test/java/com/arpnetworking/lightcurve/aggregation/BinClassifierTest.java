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

import com.arpnetworking.lightcurve.model.Kind;
import com.arpnetworking.lightcurve.model.Measurement;
import com.arpnetworking.lightcurve.model.RateMeasurement;
import com.arpnetworking.lightcurve.model.UpperLimitMeasurement;
import org.hamcrest.MatcherAssert;
import org.hamcrest.Matchers;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests for the {@link BinClassifier} class.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class BinClassifierTest {

    @Test
    public void nonDetectionIsUpperLimit() {
        final Measurement measurement = CLASSIFIER.classify(new BinTotals(10, 8.0, 100.0, 1.0), 0.9973, 0.997, false, false);
        Assert.assertTrue(measurement.isUpperLimit());
        Assert.assertEquals(Kind.UPPER_LIMIT, measurement.getKind());
        Assert.assertEquals(0.0, measurement.getRatePos(), 0.0);
        Assert.assertEquals(0.0, measurement.getRateNeg(), 0.0);
        MatcherAssert.assertThat(((UpperLimitMeasurement) measurement).getUpperLimit(), Matchers.greaterThan(0.0));
    }

    @Test
    public void detectionIsRate() {
        final Measurement measurement = CLASSIFIER.classify(new BinTotals(200, 5.0, 100.0, 1.0), 0.9973, 0.997, false, false);
        Assert.assertFalse(measurement.isUpperLimit());
        final RateMeasurement rate = (RateMeasurement) measurement;
        MatcherAssert.assertThat(rate.getRatePos(), Matchers.greaterThan(0.0));
        MatcherAssert.assertThat(rate.getRateNeg(), Matchers.lessThan(0.0));
        // Posterior mean of 196 source counts over 100 seconds.
        Assert.assertEquals(1.96, rate.getRate(), 1e-6);
    }

    @Test
    public void forceUpperLimitOverridesDetection() {
        final Measurement measurement = CLASSIFIER.classify(new BinTotals(200, 5.0, 100.0, 1.0), 0.9973, 0.997, false, true);
        Assert.assertTrue(measurement.isUpperLimit());
    }

    @Test
    public void forceRateOverridesNonDetection() {
        final Measurement measurement = CLASSIFIER.classify(new BinTotals(10, 8.0, 100.0, 1.0), 0.9973, 0.997, true, false);
        Assert.assertFalse(measurement.isUpperLimit());
        MatcherAssert.assertThat(measurement.getRateNeg(), Matchers.lessThanOrEqualTo(0.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void bothForceFlags() {
        CLASSIFIER.classify(new BinTotals(10, 8.0, 100.0, 1.0), 0.9973, 0.997, true, true);
    }

    @Test
    public void upperLimitIsCorrectedRate() {
        // With no counts and no background the bound is ln 10 counts at 90%.
        final UpperLimitMeasurement upperLimit = CLASSIFIER.upperLimit(new BinTotals(0, 0.0, 10.0, 2.0), 0.9);
        Assert.assertEquals(Math.log(10.0) * 2.0 / 10.0, upperLimit.getUpperLimit(), 1e-6);
    }

    @Test
    public void rateErrorsAreOneSigma() {
        final RateMeasurement rate = CLASSIFIER.rate(new BinTotals(10, 0.0, 1.0, 1.0));
        Assert.assertEquals(11.0, rate.getRate(), 1e-9);
        Assert.assertEquals(13.536 - 11.0, rate.getRatePos(), 1e-3);
        Assert.assertEquals(7.141 - 11.0, rate.getRateNeg(), 1e-3);
    }

    @Test
    public void rateConfidenceWidensErrors() {
        final BinTotals totals = new BinTotals(60, 3.0, 50.0, 1.1);
        final RateMeasurement oneSigma = CLASSIFIER.rate(totals);
        final RateMeasurement twoSigma = new BinClassifier(0.9545).rate(totals);
        Assert.assertEquals(oneSigma.getRate(), twoSigma.getRate(), 1e-12);
        MatcherAssert.assertThat(twoSigma.getRatePos(), Matchers.greaterThan(oneSigma.getRatePos()));
        MatcherAssert.assertThat(twoSigma.getRateNeg(), Matchers.lessThan(oneSigma.getRateNeg()));
    }

    @Test
    public void detectionDependsOnThreshold() {
        // Ten counts over eight background is significant at 50% but not at three sigma.
        final BinTotals totals = new BinTotals(10, 8.0, 100.0, 1.0);
        Assert.assertFalse(CLASSIFIER.isDetected(totals, 0.9973));
        Assert.assertTrue(CLASSIFIER.isDetected(totals, 0.5));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidRateConfidence() {
        new BinClassifier(68.27);
    }

    private static final BinClassifier CLASSIFIER = new BinClassifier();
}
