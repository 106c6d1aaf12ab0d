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

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Confidence interval and posterior mean of the source counts.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class RateInterval {

    public double getLower() {
        return _lower;
    }

    public double getUpper() {
        return _upper;
    }

    public double getMean() {
        return _mean;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }

        final RateInterval other = (RateInterval) object;

        return Double.compare(_lower, other._lower) == 0
                && Double.compare(_upper, other._upper) == 0
                && Double.compare(_mean, other._mean) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_lower, _upper, _mean);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Lower", _lower)
                .add("Upper", _upper)
                .add("Mean", _mean)
                .toString();
    }

    RateInterval(final double lower, final double upper, final double mean) {
        _lower = lower;
        _upper = upper;
        _mean = mean;
    }

    private final double _lower;
    private final double _upper;
    private final double _mean;
}
