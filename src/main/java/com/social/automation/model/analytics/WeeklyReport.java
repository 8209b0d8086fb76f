package com.social.automation.model.analytics;

import java.time.LocalDate;
import java.util.List;

public record WeeklyReport(
        String isoWeek,
        LocalDate weekStart,
        List<RulePerformance> rules,
        RulePerformance best,
        RulePerformance worst
) {}
