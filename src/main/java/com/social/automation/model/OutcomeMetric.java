package com.social.automation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Running counters for one (rule, test, variant). Engagement is kept as sums so the
 * mean and population standard deviation can be derived without storing samples.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeMetric {
    private String ruleId;
    private String testId;
    private String variantId;
    private long samples;
    private long impressions;
    private long conversions;
    private long engagementCount;
    private double engagementSum;
    private double engagementSumSquares;

    @JsonIgnore
    public double getCtr() {
        return impressions > 0 ? (double) conversions / impressions : 0.0;
    }

    @JsonIgnore
    public double getEngagementMean() {
        return engagementCount > 0 ? engagementSum / engagementCount : 0.0;
    }

    @JsonIgnore
    public double getEngagementStdDev() {
        if (engagementCount < 2) return 0.0;
        double mean = getEngagementMean();
        double variance = engagementSumSquares / engagementCount - mean * mean;
        return variance > 0 ? Math.sqrt(variance) : 0.0;
    }
}
