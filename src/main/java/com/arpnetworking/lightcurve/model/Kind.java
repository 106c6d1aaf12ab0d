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
package com.arpnetworking.lightcurve.model;

/**
 * The kind of measurement carried by a {@link Bin}, and therefore the kind
 * of every bin in a {@link Dataset}.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public enum Kind {

    /**
     * A count rate with asymmetric errors.
     */
    DETECTION(false),

    /**
     * An upper limit on the count rate.
     */
    UPPER_LIMIT(true);

    /**
     * Whether this {@link Kind} reports an upper limit.
     *
     * @return True if and only if this is {@link #UPPER_LIMIT}.
     */
    public boolean isUpperLimit() {
        return _isUpperLimit;
    }

    /**
     * Look up the {@link Kind} for an upper limit flag.
     *
     * @param isUpperLimit Whether the measurement is an upper limit.
     * @return The matching {@link Kind}.
     */
    public static Kind of(final boolean isUpperLimit) {
        return isUpperLimit ? UPPER_LIMIT : DETECTION;
    }

    Kind(final boolean isUpperLimit) {
        _isUpperLimit = isUpperLimit;
    }

    private final boolean _isUpperLimit;
}
