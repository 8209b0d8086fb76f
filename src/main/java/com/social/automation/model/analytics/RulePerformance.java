package com.social.automation.model.analytics;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RulePerformance {
    private String ruleId;
    private String ruleName;
    private long responses;
    private long impressions;
    private long conversions;
    private double ctr;
    private double engagementMean;
}
