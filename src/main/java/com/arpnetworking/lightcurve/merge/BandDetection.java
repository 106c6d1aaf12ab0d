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

import com.arpnetworking.lightcurve.model.RateMeasurement;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;

/**
 * The detection test of one band. The rate fields are {@link Double#NaN}
 * when the band is not detected.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class BandDetection {

    public boolean isDetected() {
        return _detected;
    }

    public double getRate() {
        return _rate;
    }

    public double getRatePos() {
        return _ratePos;
    }

    public double getRateNeg() {
        return _rateNeg;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Detected", _detected)
                .add("Rate", _rate)
                .add("RatePos", _ratePos)
                .add("RateNeg", _rateNeg)
                .toString();
    }

    static BandDetection detected(final RateMeasurement rate) {
        return new BandDetection(true, rate.getRate(), rate.getRatePos(), rate.getRateNeg());
    }

    static BandDetection notDetected() {
        return NOT_DETECTED;
    }

    private BandDetection(final boolean detected, final double rate, final double ratePos, final double rateNeg) {
        _detected = detected;
        _rate = rate;
        _ratePos = ratePos;
        _rateNeg = rateNeg;
    }

    private final boolean _detected;
    private final double _rate;
    private final double _ratePos;
    private final double _rateNeg;

    private static final BandDetection NOT_DETECTED = new BandDetection(false, Double.NaN, Double.NaN, Double.NaN);
}
