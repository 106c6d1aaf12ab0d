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
package com.arpnetworking.lightcurve.merge;

import com.arpnetworking.lightcurve.aggregation.BinTotals;
import com.arpnetworking.lightcurve.model.Band;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;

import java.util.Optional;

/**
 * The merged upper limit of one band, with the totals it was computed from.
 * The detection is present only when the request asked for detections to be
 * reported as rates.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class BandMergeResult {

    public Band getBand() {
        return _band;
    }

    public double getUpperLimit() {
        return _upperLimit;
    }

    public long getCounts() {
        return _totals.getCounts();
    }

    public double getBackgroundCounts() {
        return _totals.getBackgroundCounts();
    }

    public double getCorrectionFactor() {
        return _totals.getCorrectionFactor();
    }

    public double getExposure() {
        return _totals.getExposure();
    }

    public Optional<BandDetection> getDetection() {
        return _detection;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Band", _band)
                .add("UpperLimit", _upperLimit)
                .add("Totals", _totals)
                .add("Detection", _detection)
                .toString();
    }

    BandMergeResult(
            final Band band,
            final double upperLimit,
            final BinTotals totals,
            final Optional<BandDetection> detection) {
        _band = band;
        _upperLimit = upperLimit;
        _totals = totals;
        _detection = detection;
    }

    private final Band _band;
    private final double _upperLimit;
    private final BinTotals _totals;
    private final Optional<BandDetection> _detection;
}
