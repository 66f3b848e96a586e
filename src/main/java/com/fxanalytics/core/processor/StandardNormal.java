package com.fxanalytics.core.processor;

/**
 * Standard normal CDF and density shared by the pricer and the surface interpolator.
 *
 * <p>The CDF uses the Abramowitz-Stegun 7.1.26 rational approximation of erf (absolute
 * error about 1.5e-7). The approximation is odd-symmetric by construction, so
 * {@code cdf(-x) == 1 - cdf(x)} holds to rounding, which keeps put-call parity exact.
 */
public final class StandardNormal {

    private static final double A1 = 0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 = 1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 = 1.061405429;
    private static final double P = 0.3275911;

    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double INV_SQRT_2PI = 1.0 / Math.sqrt(2.0 * Math.PI);

    private StandardNormal() {}

    /** Phi(x). */
    public static double cdf(double x) {
        double sign = x < 0 ? -1.0 : 1.0;
        double z = Math.abs(x) / SQRT_2;
        double t = 1.0 / (1.0 + P * z);
        double y = 1.0 - (((((A5 * t + A4) * t) + A3) * t + A2) * t + A1) * t * Math.exp(-z * z);
        return 0.5 * (1.0 + sign * y);
    }

    /** phi(x). */
    public static double pdf(double x) {
        return INV_SQRT_2PI * Math.exp(-0.5 * x * x);
    }
}
