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

import com.arpnetworking.lightcurve.model.Measurement;
import com.arpnetworking.lightcurve.model.RateMeasurement;
import com.arpnetworking.lightcurve.model.UpperLimitMeasurement;
import com.arpnetworking.lightcurve.statistics.BayesianRateEstimator;
import com.arpnetworking.lightcurve.statistics.RateInterval;
import com.google.common.base.Preconditions;

/**
 * Decides whether aggregated counts are a detection or an upper limit and
 * converts source counts into a corrected count rate.
 *
 * <p>Without a force flag the counts are a detection if and only if the
 * lower bound of the source counts at the detection threshold is above zero.
 * Detections are reported as the posterior mean with errors at the rate
 * confidence (one sigma by default); upper limits are the upper bound at the
 * upper limit confidence.
 *
 * <p>This class is immutable and safe to share between threads.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class BinClassifier {

    /**
     * Public constructor using one sigma rate errors.
     */
    public BinClassifier() {
        this(DEFAULT_RATE_CONFIDENCE);
    }

    /**
     * Public constructor.
     *
     * @param rateConfidence The confidence level of the errors on detected rates.
     */
    public BinClassifier(final double rateConfidence) {
        Preconditions.checkArgument(
                rateConfidence > 0 && rateConfidence < 1,
                "Invalid rate confidence; rateConfidence=%s",
                rateConfidence);
        _rateConfidence = rateConfidence;
    }

    /**
     * Classify aggregated counts and compute the matching measurement.
     *
     * @param totals The aggregated counts.
     * @param detectionThreshold The confidence level at which the lower bound must exceed zero.
     * @param upperLimitConfidence The confidence level of a reported upper limit.
     * @param forceRate Report a rate regardless of significance.
     * @param forceUpperLimit Report an upper limit regardless of significance.
     * @return The {@link Measurement}; a {@link RateMeasurement} or an {@link UpperLimitMeasurement}.
     * @throws IllegalArgumentException if both force flags are set or a confidence is out of range.
     */
    public Measurement classify(
            final BinTotals totals,
            final double detectionThreshold,
            final double upperLimitConfidence,
            final boolean forceRate,
            final boolean forceUpperLimit) {
        Preconditions.checkArgument(
                !(forceRate && forceUpperLimit),
                "Invalid force flags; forceRate=%s, forceUpperLimit=%s",
                forceRate,
                forceUpperLimit);
        final boolean isUpperLimit;
        if (forceUpperLimit) {
            isUpperLimit = true;
        } else if (forceRate) {
            isUpperLimit = false;
        } else {
            isUpperLimit = !isDetected(totals, detectionThreshold);
        }
        return isUpperLimit ? upperLimit(totals, upperLimitConfidence) : rate(totals);
    }

    /**
     * Whether the aggregated counts are a detection at a threshold.
     *
     * @param totals The aggregated counts.
     * @param detectionThreshold The confidence level at which the lower bound must exceed zero.
     * @return True if and only if the lower bound of the source counts is above zero.
     */
    public boolean isDetected(final BinTotals totals, final double detectionThreshold) {
        return bayesRate(totals, detectionThreshold).getLower() > 0;
    }

    /**
     * Compute the corrected count rate and its errors.
     *
     * @param totals The aggregated counts.
     * @return The {@link RateMeasurement}.
     */
    public RateMeasurement rate(final BinTotals totals) {
        final RateInterval interval = bayesRate(totals, _rateConfidence);
        return new RateMeasurement.Builder()
                .setRate(totals.toRate(interval.getMean()))
                .setRatePos(totals.toRate(interval.getUpper() - interval.getMean()))
                .setRateNeg(totals.toRate(interval.getLower() - interval.getMean()))
                .build();
    }

    /**
     * Compute the corrected count rate upper limit.
     *
     * @param totals The aggregated counts.
     * @param confidence The confidence level of the upper limit.
     * @return The {@link UpperLimitMeasurement}.
     */
    public UpperLimitMeasurement upperLimit(final BinTotals totals, final double confidence) {
        final RateInterval interval = bayesRate(totals, confidence);
        return new UpperLimitMeasurement.Builder()
                .setUpperLimit(totals.toRate(interval.getUpper()))
                .build();
    }

    public double getRateConfidence() {
        return _rateConfidence;
    }

    private static RateInterval bayesRate(final BinTotals totals, final double confidence) {
        return BayesianRateEstimator.bayesRate(totals.getCounts(), totals.getBackgroundCounts(), confidence);
    }

    private final double _rateConfidence;

    /**
     * The probability enclosed by one standard deviation of a normal distribution.
     */
    public static final double DEFAULT_RATE_CONFIDENCE = 0.6827;
}
