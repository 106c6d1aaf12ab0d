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
 * The measured part of a {@link Bin}: either a {@link RateMeasurement} or an
 * {@link UpperLimitMeasurement}. Both report positive and negative rate
 * errors; an upper limit reports zero for each.
 *
 * @author Ville Koskela (ville dot koskela at inscopemetrics dot com)
 */
public abstract class Measurement {

    /**
     * The kind of this measurement.
     *
     * @return The {@link Kind}.
     */
    public abstract Kind getKind();

    /**
     * The positive error on the rate; zero for an upper limit.
     *
     * @return The positive error.
     */
    public abstract double getRatePos();

    /**
     * The negative error on the rate, negative by convention; zero for an
     * upper limit.
     *
     * @return The negative error.
     */
    public abstract double getRateNeg();

    public boolean isUpperLimit() {
        return getKind().isUpperLimit();
    }

    Measurement() { }
}
