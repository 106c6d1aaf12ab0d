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

/**
 * Thrown when a numerical method fails to reach its documented tolerance.
 * Results are never approximated past this point; the failure indicates a
 * defect rather than a condition the caller can retry.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class ConvergenceException extends ArithmeticException {

    /**
     * Public constructor.
     *
     * @param message The message, including the inputs that failed to converge.
     */
    public ConvergenceException(final String message) {
        super(message);
    }

    private static final long serialVersionUID = 4175069853128816532L;
}
