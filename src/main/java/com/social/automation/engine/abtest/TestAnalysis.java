package com.social.automation.engine.abtest;

import java.util.List;
import java.util.Map;

/**
 * Outcome of significance testing for one embedded test. {@code winner} is null with
 * {@code reason = "insufficient_data"} when fewer than two variants have enough samples.
 */
public record TestAnalysis(
        String testId,
        String winner,
        String runnerUp,
        Double pValue,
        String metric,
        String reason,
        Map<String, VariantStats> stats,
        List<Suggestion> suggestions
) {

    public static final String INSUFFICIENT_DATA = "insufficient_data";

    public boolean isSignificant(double threshold) {
        return winner != null && pValue != null && pValue <= threshold;
    }
}
