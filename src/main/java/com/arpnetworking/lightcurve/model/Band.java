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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The energy bands of a catalogue upper limit table.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public enum Band {

    /**
     * The full energy range.
     */
    TOTAL("Total"),

    /**
     * The soft band.
     */
    SOFT("Soft"),

    /**
     * The medium band.
     */
    MEDIUM("Medium"),

    /**
     * The hard band.
     */
    HARD("Hard");

    @JsonValue
    public String getName() {
        return _name;
    }

    /**
     * Look up a band by name, ignoring case.
     *
     * @param name The band name, for example {@code soft}.
     * @return The {@link Band}.
     * @throws IllegalArgumentException if no band has that name.
     */
    @JsonCreator
    public static Band fromName(final String name) {
        final String normalized = name.toLowerCase(Locale.ROOT);
        for (final Band band : values()) {
            if (band._name.toLowerCase(Locale.ROOT).equals(normalized)) {
                return band;
            }
        }
        throw new IllegalArgumentException(String.format("Invalid band name; name=%s", name));
    }

    Band(final String name) {
        _name = name;
    }

    private final String _name;
}
