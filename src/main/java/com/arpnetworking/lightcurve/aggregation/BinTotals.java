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

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Summed countable quantities of a set of bins. The correction factor is the
 * exposure weighted mean of the selected correction factors.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class BinTotals {

    public long getCounts() {
        return _counts;
    }

    public double getBackgroundCounts() {
        return _backgroundCounts;
    }

    public double getExposure() {
        return _exposure;
    }

    public double getCorrectionFactor() {
        return _correctionFactor;
    }

    /**
     * Convert source counts into a corrected count rate.
     *
     * @param sourceCounts The source counts.
     * @return The count rate.
     */
    public double toRate(final double sourceCounts) {
        return sourceCounts * _correctionFactor / _exposure;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final BinTotals other = (BinTotals) object;

        return _counts == other._counts
                && Double.compare(_backgroundCounts, other._backgroundCounts) == 0
                && Double.compare(_exposure, other._exposure) == 0
                && Double.compare(_correctionFactor, other._correctionFactor) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_counts, _backgroundCounts, _exposure, _correctionFactor);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Counts", _counts)
                .add("BackgroundCounts", _backgroundCounts)
                .add("Exposure", _exposure)
                .add("CorrectionFactor", _correctionFactor)
                .toString();
    }

    /**
     * Public constructor.
     *
     * @param counts The total counts in the source region.
     * @param backgroundCounts The total expected background counts.
     * @param exposure The total exposure; must be positive.
     * @param correctionFactor The exposure weighted correction factor; must be positive.
     */
    public BinTotals(final long counts, final double backgroundCounts, final double exposure, final double correctionFactor) {
        _counts = counts;
        _backgroundCounts = backgroundCounts;
        _exposure = exposure;
        _correctionFactor = correctionFactor;
    }

    private final long _counts;
    private final double _backgroundCounts;
    private final double _exposure;
    private final double _correctionFactor;
}
