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

import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;

/**
 * The outcome of merging light curve bins.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class MergeResult {

    public boolean isUpperLimit() {
        return _mergedBin.isUpperLimit();
    }

    public boolean wasInserted() {
        return _inserted;
    }

    public MergedBin getMergedBin() {
        return _mergedBin;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("UpperLimit", isUpperLimit())
                .add("Inserted", _inserted)
                .add("MergedBin", _mergedBin)
                .toString();
    }

    MergeResult(final boolean inserted, final MergedBin mergedBin) {
        _inserted = inserted;
        _mergedBin = mergedBin;
    }

    private final boolean _inserted;
    private final MergedBin _mergedBin;
}
