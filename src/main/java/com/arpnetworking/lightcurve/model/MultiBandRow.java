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

import com.arpnetworking.commons.builder.OvalBuilder;
import com.arpnetworking.logback.annotations.Loggable;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import net.sf.oval.constraint.NotNull;

import java.util.Map;
import java.util.Optional;

/**
 * One row of a catalogue upper limit table. Each band is independent and may
 * be absent.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@Loggable
public final class MultiBandRow {

    /**
     * Get the columns of one band.
     *
     * @param band The band.
     * @return The {@link BandColumns}, if this row carries the band.
     */
    public Optional<BandColumns> getBand(final Band band) {
        return Optional.ofNullable(_bands.get(band));
    }

    public ImmutableMap<Band, BandColumns> getBands() {
        return _bands;
    }

    @Override
    public boolean equals(final Object object) {
        if (this == object) {
            return true;
        }
        if (object == null || getClass() != object.getClass()) {
            return false;
        }
        return _bands.equals(((MultiBandRow) object)._bands);
    }

    @Override
    public int hashCode() {
        return _bands.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("Bands", _bands)
                .toString();
    }

    private MultiBandRow(final Builder builder) {
        _bands = builder._bands;
    }

    private final ImmutableMap<Band, BandColumns> _bands;

    /**
     * {@link com.arpnetworking.commons.builder.Builder} implementation for
     * {@link MultiBandRow}.
     */
    public static final class Builder extends OvalBuilder<MultiBandRow> {

        /**
         * Public constructor.
         */
        public Builder() {
            super(MultiBandRow::new);
        }

        /**
         * Set the columns of every band. Optional. Cannot be null. Defaults to no bands.
         *
         * @param value The columns by band.
         * @return This {@link Builder} instance.
         */
        public Builder setBands(final Map<Band, BandColumns> value) {
            _bands = ImmutableMap.copyOf(value);
            return this;
        }

        /**
         * Set the columns of one band.
         *
         * @param band The band.
         * @param value The columns of the band.
         * @return This {@link Builder} instance.
         */
        public Builder putBand(final Band band, final BandColumns value) {
            _bands = ImmutableMap.<Band, BandColumns>builder()
                    .putAll(_bands)
                    .put(band, value)
                    .buildKeepingLast();
            return this;
        }

        @NotNull
        private ImmutableMap<Band, BandColumns> _bands = ImmutableMap.of();
    }
}
