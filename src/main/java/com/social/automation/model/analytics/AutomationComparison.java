package com.social.automation.model.analytics;

public record AutomationComparison(
        String ruleId,
        int windowDays,
        RulePerformance automated,
        RulePerformance manual,
        double ctrDelta,
        double engagementDelta
) {}
