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

import java.util.Optional;

/**
 * The result of aggregating bins of a light curve: the {@link BinTotals} and
 * the merged time interval and background.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class AggregatedBins {

    public BinTotals getTotals() {
        return _totals;
    }

    public double getTime() {
        return _time;
    }

    public double getTimePos() {
        return _timePos;
    }

    public double getTimeNeg() {
        return _timeNeg;
    }

    /**
     * The fraction of the merged interval covered by exposure.
     *
     * @return The fractional exposure.
     */
    public double getFractionalExposure() {
        final double duration = _timePos + _timeNeg;
        if (duration <= 0) {
            return 1.0;
        }
        return _totals.getExposure() / duration;
    }

    public Optional<Double> getBackgroundRate() {
        return _backgroundRate;
    }

    public Optional<Double> getBackgroundRateError() {
        return _backgroundRateError;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Totals", _totals)
                .add("Time", _time)
                .add("TimePos", _timePos)
                .add("TimeNeg", _timeNeg)
                .add("BackgroundRate", _backgroundRate)
                .add("BackgroundRateError", _backgroundRateError)
                .toString();
    }

    AggregatedBins(
            final BinTotals totals,
            final double time,
            final double timePos,
            final double timeNeg,
            final Optional<Double> backgroundRate,
            final Optional<Double> backgroundRateError) {
        _totals = totals;
        _time = time;
        _timePos = timePos;
        _timeNeg = timeNeg;
        _backgroundRate = backgroundRate;
        _backgroundRateError = backgroundRateError;
    }

    private final BinTotals _totals;
    private final double _time;
    private final double _timePos;
    private final double _timeNeg;
    private final Optional<Double> _backgroundRate;
    private final Optional<Double> _backgroundRateError;
}
