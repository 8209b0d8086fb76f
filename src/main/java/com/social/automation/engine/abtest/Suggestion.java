package com.social.automation.engine.abtest;

public record Suggestion(Type type, String testId, String variantId, double pValue, String detail) {

    public enum Type {
        /** winner is significant: shift weight to it */
        REWEIGHT_WINNER,
        /** worst variant is significantly below the best: set its weight to 0 */
        PAUSE_VARIANT,
        /** near-significant: run a follow-up test, never applied automatically */
        FOLLOW_UP_TEST
    }
}
