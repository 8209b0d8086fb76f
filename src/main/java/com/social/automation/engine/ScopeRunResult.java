package com.social.automation.engine;

import com.social.automation.model.ExecutionOutcome;

import java.util.Map;

/**
 * Summary of one rule-engine run over a scope.
 */
public record ScopeRunResult(String scopeId, int itemsConsidered, int executed,
                             Map<ExecutionOutcome, Integer> outcomes, RunPlan plan) {}
