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
package com.arpnetworking.lightcurve.configuration;

import com.arpnetworking.lightcurve.aggregation.BinClassifier;
import com.arpnetworking.lightcurve.model.Band;
import com.google.common.collect.ImmutableList;
import net.sf.oval.exception.ConstraintsViolatedException;
import org.junit.Assert;
import org.junit.Test;

import java.io.File;

/**
 * Tests for the {@link MergerConfiguration} and {@link ConfidenceLevels} classes.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public class MergerConfigurationTest {

    @Test
    public void defaults() {
        final MergerConfiguration configuration = MergerConfiguration.defaults();
        Assert.assertEquals(0.997, configuration.getUpperLimitConfidence(), 0.0);
        Assert.assertEquals(0.997, configuration.getDetectionThreshold(), 0.0);
        Assert.assertEquals(BinClassifier.DEFAULT_RATE_CONFIDENCE, configuration.getRateConfidence(), 0.0);
        Assert.assertEquals(ImmutableList.of(Band.TOTAL, Band.SOFT, Band.MEDIUM, Band.HARD), configuration.getBands());
    }

    @Test
    public void fromJson() throws Exception {
        final MergerConfiguration configuration = MergerConfiguration.fromJson(
                "{\"upperLimitConfidence\": 99.0, \"detectionThreshold\": 0.9973, \"bands\": [\"soft\", \"Hard\"]}");
        Assert.assertEquals(0.99, configuration.getUpperLimitConfidence(), 1e-12);
        Assert.assertEquals(0.9973, configuration.getDetectionThreshold(), 0.0);
        Assert.assertEquals(ImmutableList.of(Band.SOFT, Band.HARD), configuration.getBands());
    }

    @Test
    public void fromFile() throws Exception {
        final File file = new File(getClass().getResource("/merger-configuration.json").toURI());
        final MergerConfiguration configuration = MergerConfiguration.fromFile(file);
        Assert.assertEquals(0.9973, configuration.getUpperLimitConfidence(), 1e-12);
        Assert.assertEquals(0.9973, configuration.getDetectionThreshold(), 1e-12);
        Assert.assertEquals(0.9545, configuration.getRateConfidence(), 1e-12);
        Assert.assertEquals(ImmutableList.of(Band.TOTAL), configuration.getBands());
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void invalidConfidence() throws Exception {
        MergerConfiguration.fromJson("{\"upperLimitConfidence\": 1.0}");
    }

    @Test(expected = ConstraintsViolatedException.class)
    public void emptyBands() {
        new MergerConfiguration.Builder().setBands(ImmutableList.of()).build();
    }

    @Test
    public void normalizePercentage() {
        Assert.assertEquals(0.5, ConfidenceLevels.normalize("confidence", 50.0), 0.0);
        Assert.assertEquals(0.6827, ConfidenceLevels.normalize("confidence", 0.6827), 0.0);
        Assert.assertTrue(ConfidenceLevels.isValid(99.7));
        Assert.assertFalse(ConfidenceLevels.isValid(1.0));
        Assert.assertFalse(ConfidenceLevels.isValid(100.0));
        Assert.assertFalse(ConfidenceLevels.isValid(0.0));
    }

    @Test
    public void normalizeInvalid() {
        try {
            ConfidenceLevels.normalize("upperLimitConfidence", -0.5);
            Assert.fail("Expected exception");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("upperLimitConfidence=-0.5"));
        }
    }
}
