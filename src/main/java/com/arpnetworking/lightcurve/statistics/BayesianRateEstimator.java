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

import com.google.common.base.Preconditions;

/**
 * Confidence intervals on Poisson source counts with a known background,
 * after Kraft, Burrows &amp; Nousek (1991, ApJ 374, 344).
 *
 * <p>Given {@code N} measured counts and {@code B} expected background
 * counts the posterior density of the source counts {@code S >= 0} is
 * <pre>
 *   p(S | N, B) = C * exp(-(S + B)) * (S + B)^N / N!
 *   1 / C       = P(Poisson(B) &lt;= N) = Q(N + 1, B)
 * </pre>
 * The reported interval is the shortest one enclosing the requested
 * probability, which is the interval whose end points have equal posterior
 * density. When the density at {@code S = 0} is at least that at the
 * one-sided bound the interval is pinned at zero.
 *
 * <p>The enclosed probability of every returned interval matches the
 * requested confidence to within {@code 1e-6}; otherwise a
 * {@link ConvergenceException} is thrown. Backgrounds above
 * {@link #MAX_BACKGROUND} cannot be resolved to that tolerance in double
 * precision and are rejected as invalid arguments.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class BayesianRateEstimator {

    /**
     * Compute the confidence interval and posterior mean of the source counts.
     *
     * @param counts The total counts measured in the source region.
     * @param background The expected background counts in the source region, at most {@link #MAX_BACKGROUND}.
     * @param confidence The confidence level, in the open interval (0, 1).
     * @return The {@link RateInterval} of the source counts.
     * @throws IllegalArgumentException if an argument is out of range.
     * @throws ConvergenceException if the interval cannot be located to tolerance.
     */
    public static RateInterval bayesRate(final long counts, final double background, final double confidence) {
        checkArguments(counts, background, confidence);
        final Posterior posterior = new Posterior(counts, background);

        final double oneSided = posterior.oneSidedBound(confidence);
        final double mode = posterior.mode();
        if (mode == 0 || posterior.logDensity(0) >= posterior.logDensity(oneSided)) {
            return new RateInterval(0, oneSided, posterior.mean());
        }

        // The enclosed mass shrinks monotonically as the lower end approaches the mode.
        double low = 0;
        double high = mode;
        for (int i = 0; i < MAX_BISECTIONS && high - low > RESOLUTION * mode; ++i) {
            final double lower = 0.5 * (low + high);
            if (posterior.mass(lower, posterior.equalDensityPartner(lower)) > confidence) {
                low = lower;
            } else {
                high = lower;
            }
        }
        final double lower = 0.5 * (low + high);
        final double upper = posterior.equalDensityPartner(lower);
        final double mass = posterior.mass(lower, upper);
        if (Math.abs(mass - confidence) > MASS_TOLERANCE) {
            throw new ConvergenceException(String.format(
                    "Confidence interval did not converge; counts=%d, background=%s, confidence=%s, lower=%s, upper=%s, mass=%s",
                    counts,
                    background,
                    confidence,
                    lower,
                    upper,
                    mass));
        }
        return new RateInterval(lower, upper, posterior.mean());
    }

    /**
     * Compute the one-sided upper bound on the source counts; that is, the
     * value {@code Smax} for which {@code P(S <= Smax | N, B) = confidence}.
     * With no background this is the classical one-sided Poisson upper limit.
     *
     * @param counts The total counts measured in the source region.
     * @param background The expected background counts in the source region, at most {@link #MAX_BACKGROUND}.
     * @param confidence The confidence level, in the open interval (0, 1).
     * @return The upper bound on the source counts.
     * @throws IllegalArgumentException if an argument is out of range.
     * @throws ConvergenceException if the bound cannot be located to tolerance.
     */
    public static double upperBound(final long counts, final double background, final double confidence) {
        checkArguments(counts, background, confidence);
        return new Posterior(counts, background).oneSidedBound(confidence);
    }

    private static void checkArguments(final long counts, final double background, final double confidence) {
        Preconditions.checkArgument(counts >= 0, "Invalid counts; counts=%s", counts);
        Preconditions.checkArgument(
                background >= 0 && background <= MAX_BACKGROUND,
                "Invalid background; background=%s",
                background);
        Preconditions.checkArgument(
                confidence > 0 && confidence < 1,
                "Invalid confidence; confidence=%s",
                confidence);
    }

    private BayesianRateEstimator() {}

    /**
     * The largest expected background accepted.
     */
    public static final double MAX_BACKGROUND = 1e9;

    private static final int MAX_BISECTIONS = 200;
    private static final double RESOLUTION = 1e-13;
    private static final double MASS_TOLERANCE = 1e-6;

    /**
     * The posterior of the source counts for one {@code (N, B)} pair.
     */
    private static final class Posterior {

        Posterior(final long counts, final double background) {
            _counts = counts;
            _background = background;
            _logNormalization = GammaFunctions.logRegularizedUpper(counts + 1.0, background);
        }

        double mode() {
            return Math.max(0.0, _counts - _background);
        }

        double mean() {
            if (_counts == 0) {
                return 1.0;
            }
            // E[S] = N + 1 - B * Q(N, B) / Q(N + 1, B)
            final double ratio = Math.exp(GammaFunctions.logRegularizedUpper(_counts, _background) - _logNormalization);
            return Math.max(0.0, _counts + 1.0 - _background * ratio);
        }

        // Unnormalized.
        double logDensity(final double sourceCounts) {
            final double total = sourceCounts + _background;
            if (_counts == 0) {
                return -total;
            }
            return _counts * Math.log(total) - total;
        }

        // P(S > s)
        double logTail(final double sourceCounts) {
            if (sourceCounts <= 0) {
                return 0.0;
            }
            return GammaFunctions.logRegularizedUpper(_counts + 1.0, _background + sourceCounts) - _logNormalization;
        }

        double mass(final double lower, final double upper) {
            return Math.exp(logTail(lower)) - Math.exp(logTail(upper));
        }

        double oneSidedBound(final double confidence) {
            final double target = Math.log1p(-confidence);
            double low = 0;
            double step = initialStep();
            double high = mode() + step;
            int expansions = 0;
            while (logTail(high) > target) {
                if (++expansions > MAX_BISECTIONS) {
                    throw notBracketed("one-sided bound", confidence);
                }
                low = high;
                step *= 2;
                high += step;
            }
            for (int i = 0; i < MAX_BISECTIONS && high - low > RESOLUTION * Math.max(1.0, high); ++i) {
                final double middle = 0.5 * (low + high);
                if (logTail(middle) > target) {
                    low = middle;
                } else {
                    high = middle;
                }
            }
            final double bound = 0.5 * (low + high);
            final double mass = -Math.expm1(logTail(bound));
            if (Math.abs(mass - confidence) > MASS_TOLERANCE) {
                throw new ConvergenceException(String.format(
                        "One-sided bound did not converge; counts=%d, background=%s, confidence=%s, bound=%s, mass=%s",
                        _counts,
                        _background,
                        confidence,
                        bound,
                        mass));
            }
            return bound;
        }

        // The point above the mode with the same density as the given point below it.
        double equalDensityPartner(final double sourceCounts) {
            final double target = logDensity(sourceCounts);
            double low = mode();
            double step = initialStep();
            double high = low + step;
            int expansions = 0;
            while (logDensity(high) > target) {
                if (++expansions > MAX_BISECTIONS) {
                    throw notBracketed("equal density partner", sourceCounts);
                }
                low = high;
                step *= 2;
                high += step;
            }
            for (int i = 0; i < MAX_BISECTIONS && high - low > RESOLUTION * Math.max(1.0, high); ++i) {
                final double middle = 0.5 * (low + high);
                if (logDensity(middle) > target) {
                    low = middle;
                } else {
                    high = middle;
                }
            }
            return 0.5 * (low + high);
        }

        private double initialStep() {
            return Math.max(1.0, Math.sqrt(_counts + 1.0));
        }

        private ConvergenceException notBracketed(final String what, final double argument) {
            return new ConvergenceException(String.format(
                    "Unable to bracket %s; counts=%d, background=%s, argument=%s",
                    what,
                    _counts,
                    _background,
                    argument));
        }

        private final long _counts;
        private final double _background;
        private final double _logNormalization;
    }
}
