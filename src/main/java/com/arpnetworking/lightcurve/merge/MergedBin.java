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

import com.arpnetworking.lightcurve.model.Bin;
import com.arpnetworking.lightcurve.model.Measurement;
import com.arpnetworking.lightcurve.model.RateMeasurement;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A bin produced by merging selected bins. It carries the merged
 * measurement and the totals it was derived from, and becomes part of a
 * dataset only if it is inserted.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class MergedBin {

    public Bin getBin() {
        return _bin;
    }

    public boolean isUpperLimit() {
        return _bin.getKind().isUpperLimit();
    }

    public Measurement getMeasurement() {
        return _bin.getMeasurement();
    }

    /**
     * The signal to noise ratio of a detected rate.
     *
     * @return The signal to noise ratio; zero for an upper limit.
     */
    public double getSignalToNoise() {
        if (_bin.getMeasurement() instanceof RateMeasurement) {
            return ((RateMeasurement) _bin.getMeasurement()).getSignalToNoise();
        }
        return 0;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        return Objects.equal(_bin, ((MergedBin) object)._bin);
    }

    @Override
    public int hashCode() {
        return _bin.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Bin", _bin)
                .add("SignalToNoise", getSignalToNoise())
                .toString();
    }

    MergedBin(final Bin bin) {
        _bin = bin;
    }

    private final Bin _bin;
}
