package com.social.automation.model.analytics;

/**
 * Operator-facing recommendation. {@code kind} is one of the A/B suggestion types
 * (reweight_winner, pause_variant, follow_up_test) or investigate_ctr_drop.
 */
public record RuleSuggestion(
        String ruleId,
        String kind,
        String testId,
        String variantId,
        Double pValue,
        String detail
) {}
