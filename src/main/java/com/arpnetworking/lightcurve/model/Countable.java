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
 * The countable quantities of one extraction: the counts in the source
 * region, the expected background counts in the same region, the
 * correction factor and the exposure.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface Countable {

    /**
     * The measured counts in the source region.
     *
     * @return The counts; never negative.
     */
    long getCountsInSource();

    /**
     * The expected background counts in the source region.
     *
     * @return The background counts; never negative.
     */
    double getBackgroundCounts();

    /**
     * The factor converting detected counts into incident source counts.
     *
     * @return The correction factor; always positive.
     */
    double getCorrectionFactor();

    /**
     * The exposure in seconds.
     *
     * @return The exposure; always positive.
     */
    double getExposure();
}
