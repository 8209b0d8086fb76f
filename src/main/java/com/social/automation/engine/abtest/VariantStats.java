package com.social.automation.engine.abtest;

public record VariantStats(
        String variantId,
        long n,
        long impressions,
        long conversions,
        double ctr,
        long engagementCount,
        double engagementMean,
        double engagementStdDev
) {

    public double metric(String metric) {
        return SignificanceEngine.METRIC_CTR.equals(metric) ? ctr : engagementMean;
    }
}
