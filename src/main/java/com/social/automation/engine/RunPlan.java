package com.social.automation.engine;

import com.social.automation.model.AutomationRule;

import java.util.List;

/**
 * Per-scope, per-tick limits derived once from the scope's enabled rules.
 *
 * @param maxResponses    smallest non-zero per-run limit across the rules, or the default
 * @param autoPostAllowed true if any rule may post without approval
 */
public record RunPlan(int maxResponses, boolean autoPostAllowed) {

    public static RunPlan from(List<AutomationRule> enabledRules, int defaultMaxResponses) {
        int max = enabledRules.stream()
                .mapToInt(AutomationRule::getResponseLimitPerRun)
                .filter(limit -> limit > 0)
                .min()
                .orElse(defaultMaxResponses);
        boolean autoPost = enabledRules.stream().anyMatch(r -> !r.isRequireApproval());
        return new RunPlan(max, autoPost);
    }
}
