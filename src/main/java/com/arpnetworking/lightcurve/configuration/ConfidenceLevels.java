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
package com.arpnetworking.lightcurve.configuration;

/**
 * Normalizes confidence levels supplied either as probabilities or as
 * percentages.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class ConfidenceLevels {

    /**
     * Normalize a confidence level to a probability. Values in {@code (1, 100)}
     * are taken to be percentages.
     *
     * @param name The name of the parameter, used in the error message.
     * @param value The confidence level.
     * @return The confidence level as a probability in {@code (0, 1)}.
     * @throws IllegalArgumentException if the value is not a valid confidence level.
     */
    public static double normalize(final String name, final double value) {
        double probability = value;
        if (value > 1 && value < 100) {
            probability = value / 100.0;
        }
        if (!(probability > 0 && probability < 1)) {
            throw new IllegalArgumentException(String.format("Invalid confidence level; %s=%s", name, value));
        }
        return probability;
    }

    /**
     * Whether a value is a valid confidence level, either as a probability or
     * as a percentage.
     *
     * @param value The confidence level.
     * @return True if and only if {@link #normalize(String, double)} accepts the value.
     */
    public static boolean isValid(final double value) {
        return (value > 0 && value < 1) || (value > 1 && value < 100);
    }

    private ConfidenceLevels() {}
}
