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
 * Gamma function and regularized incomplete gamma functions. All results
 * are computed in log space so that arguments in the millions neither
 * overflow nor underflow.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
final class GammaFunctions {

    /**
     * Natural log of the gamma function using the Lanczos approximation.
     *
     * @param x The argument; must be positive.
     * @return ln &Gamma;(x)
     */
    static double lnGamma(final double x) {
        Preconditions.checkArgument(x > 0, "Invalid gamma argument; x=%s", x);
        double y = x;
        double tmp = x + 5.5;
        tmp -= (x + 0.5) * Math.log(tmp);
        double series = 1.000000000190015;
        for (final double coefficient : LANCZOS_COEFFICIENTS) {
            series += coefficient / ++y;
        }
        return -tmp + Math.log(SQRT_TWO_PI * series / x);
    }

    /**
     * Natural log of the regularized upper incomplete gamma function Q(a, x).
     *
     * @param a The shape; must be positive.
     * @param x The lower integration limit; must be non-negative.
     * @return ln Q(a, x)
     */
    static double logRegularizedUpper(final double a, final double x) {
        Preconditions.checkArgument(a > 0, "Invalid gamma shape; a=%s", a);
        Preconditions.checkArgument(x >= 0, "Invalid gamma limit; x=%s", x);
        if (x == 0) {
            return 0.0;
        }
        if (x < a + 1.0) {
            return Math.log1p(-Math.exp(logLowerSeries(a, x)));
        }
        return logUpperContinuedFraction(a, x);
    }

    private static double logPrefactor(final double a, final double x) {
        return -x + a * Math.log(x) - lnGamma(a);
    }

    // Converges quickly for x < a + 1.
    private static double logLowerSeries(final double a, final double x) {
        double denominator = a;
        double term = 1.0 / a;
        double sum = term;
        for (int i = 0; i < MAX_ITERATIONS; ++i) {
            ++denominator;
            term *= x / denominator;
            sum += term;
            if (Math.abs(term) < Math.abs(sum) * EPSILON) {
                return Math.log(sum) + logPrefactor(a, x);
            }
        }
        throw new ConvergenceException(String.format(
                "Incomplete gamma series did not converge; a=%s, x=%s, iterations=%d",
                a,
                x,
                MAX_ITERATIONS));
    }

    // Modified Lentz evaluation; converges quickly for x >= a + 1.
    private static double logUpperContinuedFraction(final double a, final double x) {
        double b = x + 1.0 - a;
        double c = 1.0 / TINY;
        double d = 1.0 / b;
        double h = d;
        for (int i = 1; i <= MAX_ITERATIONS; ++i) {
            final double an = -i * (i - a);
            b += 2.0;
            d = an * d + b;
            if (Math.abs(d) < TINY) {
                d = TINY;
            }
            c = b + an / c;
            if (Math.abs(c) < TINY) {
                c = TINY;
            }
            d = 1.0 / d;
            final double delta = d * c;
            h *= delta;
            if (Math.abs(delta - 1.0) < EPSILON) {
                return Math.log(h) + logPrefactor(a, x);
            }
        }
        throw new ConvergenceException(String.format(
                "Incomplete gamma continued fraction did not converge; a=%s, x=%s, iterations=%d",
                a,
                x,
                MAX_ITERATIONS));
    }

    private GammaFunctions() {}

    private static final int MAX_ITERATIONS = 1_000_000;
    private static final double EPSILON = 1e-15;
    private static final double TINY = 1e-300;
    private static final double SQRT_TWO_PI = 2.5066282746310005;
    private static final double[] LANCZOS_COEFFICIENTS = {
        76.18009172947146,
        -86.50532032941677,
        24.01409824083091,
        -1.231739572450155,
        0.001208650973866179,
        -0.000005395239384953,
    };
}
