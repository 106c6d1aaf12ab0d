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

import com.arpnetworking.lightcurve.model.Band;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * The merged upper limits of a multi-band table, keyed by band. Requested
 * bands the table does not carry have no entry.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
@Loggable
public final class MultiBandMergeResult {

    public ImmutableMap<Band, BandMergeResult> getBands() {
        return _bands;
    }

    /**
     * Get the result of one band.
     *
     * @param band The band.
     * @return The {@link BandMergeResult}, or empty if the band was not merged.
     */
    public Optional<BandMergeResult> getBand(final Band band) {
        return Optional.ofNullable(_bands.get(band));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Bands", _bands)
                .toString();
    }

    MultiBandMergeResult(final ImmutableMap<Band, BandMergeResult> bands) {
        _bands = bands;
    }

    private final ImmutableMap<Band, BandMergeResult> _bands;
}
