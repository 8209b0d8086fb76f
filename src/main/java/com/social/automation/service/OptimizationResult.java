package com.social.automation.service;

import com.social.automation.engine.abtest.TestAnalysis;
import com.social.automation.model.Variant;

import java.util.List;
import java.util.Map;

public record OptimizationResult(
        String ruleId,
        boolean updated,
        String reason,
        Map<String, TestAnalysis> analysis,
        Map<String, List<Variant>> abTests
) {}
