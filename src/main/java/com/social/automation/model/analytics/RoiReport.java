package com.social.automation.model.analytics;

public record RoiReport(
        String ruleId,
        int windowDays,
        long responses,
        double hoursSaved,
        double laborValue,
        double cost,
        double roi
) {}
