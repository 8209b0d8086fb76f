package com.social.automation.engine.abtest;

/**
 * Standard normal tail areas, using the Abramowitz-Stegun 7.1.26 approximation of erf
 * (absolute error below 1.5e-7).
 */
public final class NormalDistribution {

    private static final double P = 0.3275911;
    private static final double A1 = 0.254829592;
    private static final double A2 = -0.284496736;
    private static final double A3 = 1.421413741;
    private static final double A4 = -1.453152027;
    private static final double A5 = 1.061405429;

    private NormalDistribution() {}

    public static double erf(double x) {
        double sign = x < 0 ? -1.0 : 1.0;
        double ax = Math.abs(x);
        double t = 1.0 / (1.0 + P * ax);
        double poly = ((((A5 * t + A4) * t + A3) * t + A2) * t + A1) * t;
        return sign * (1.0 - poly * Math.exp(-ax * ax));
    }

    public static double cdf(double z) {
        return 0.5 * (1.0 + erf(z / Math.sqrt(2.0)));
    }

    /**
     * Two-tailed p-value for a statistic {@code z} under the standard normal.
     */
    public static double twoTailedPValue(double z) {
        double p = 2.0 * (1.0 - cdf(Math.abs(z)));
        return Math.max(0.0, Math.min(1.0, p));
    }
}
