package com.social.automation.model.analytics;

import java.util.List;

public record BestWorstReport(int windowDays, List<RulePerformance> best, List<RulePerformance> worst) {}
