package com.social.automation.engine.abtest;

import com.social.automation.config.AbTestingConfig;
import com.social.automation.model.OutcomeMetric;
import com.social.automation.repository.OutcomeMetricRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Picks per-test winners from accumulated outcome counters.
 * <p>
 * CTR is compared with a two-tailed two-proportion z-test whenever any eligible variant has
 * impressions; otherwise mean engagement is compared with a Welch-style statistic using
 * population standard deviations. Both map their statistic to a p-value through the normal
 * tail, so the engagement p-value is an approximation of the Student-t result.
 */
@Component
public class SignificanceEngine {

    private static final Logger log = LoggerFactory.getLogger(SignificanceEngine.class);

    public static final String METRIC_CTR = "ctr";
    public static final String METRIC_ENGAGEMENT = "engagement";

    private final OutcomeMetricRepository outcomeRepo;
    private final AbTestingConfig config;

    public SignificanceEngine(OutcomeMetricRepository outcomeRepo, AbTestingConfig config) {
        this.outcomeRepo = outcomeRepo;
        this.config = config;
    }

    @Observed(name = "abtest.calculate_winner", contextualName = "calculate-winner")
    public Map<String, TestAnalysis> calculateWinner(String ruleId, int minSamplesPerVariant) {
        Map<String, List<OutcomeMetric>> byTest = new TreeMap<>();
        for (OutcomeMetric metric : outcomeRepo.findByRule(ruleId)) {
            byTest.computeIfAbsent(metric.getTestId(), k -> new ArrayList<>()).add(metric);
        }

        Map<String, TestAnalysis> results = new LinkedHashMap<>();
        for (Map.Entry<String, List<OutcomeMetric>> test : byTest.entrySet()) {
            results.put(test.getKey(), analyze(test.getKey(), test.getValue(), minSamplesPerVariant));
        }
        log.debug("Significance analysis for rule {}: {} tests", ruleId, results.size());
        return results;
    }

    TestAnalysis analyze(String testId, List<OutcomeMetric> metrics, int minSamplesPerVariant) {
        Map<String, VariantStats> stats = new TreeMap<>();
        for (OutcomeMetric m : metrics) {
            stats.put(m.getVariantId(), toStats(m));
        }

        List<VariantStats> eligible = stats.values().stream()
                .filter(s -> s.n() >= minSamplesPerVariant)
                .toList();
        if (eligible.size() < 2) {
            return new TestAnalysis(testId, null, null, null, null,
                    TestAnalysis.INSUFFICIENT_DATA, stats, List.of());
        }

        String metric = eligible.stream().anyMatch(s -> s.impressions() > 0) ? METRIC_CTR : METRIC_ENGAGEMENT;
        List<VariantStats> ranked = new ArrayList<>(eligible);
        ranked.sort(Comparator.comparingDouble((VariantStats s) -> s.metric(metric)).reversed()
                .thenComparing(VariantStats::variantId));

        VariantStats best = ranked.get(0);
        VariantStats runnerUp = ranked.get(1);
        double pValue = compare(metric, best, runnerUp);

        List<Suggestion> suggestions = new ArrayList<>();
        if (pValue <= config.getSignificanceThreshold()) {
            suggestions.add(new Suggestion(Suggestion.Type.REWEIGHT_WINNER, testId, best.variantId(), pValue,
                    String.format("%s beats %s on %s (p=%.4f)", best.variantId(), runnerUp.variantId(), metric, pValue)));
        } else if (pValue <= config.getFollowUpThreshold()) {
            suggestions.add(new Suggestion(Suggestion.Type.FOLLOW_UP_TEST, testId, best.variantId(), pValue,
                    String.format("%s leads %s but is inconclusive (p=%.4f)", best.variantId(), runnerUp.variantId(), pValue)));
        }

        VariantStats worst = ranked.get(ranked.size() - 1);
        double worstPValue = worst == runnerUp ? pValue : compare(metric, best, worst);
        if (worstPValue <= config.getSignificanceThreshold()) {
            suggestions.add(new Suggestion(Suggestion.Type.PAUSE_VARIANT, testId, worst.variantId(), worstPValue,
                    String.format("%s is significantly below %s (p=%.4f)", worst.variantId(), best.variantId(), worstPValue)));
        }

        return new TestAnalysis(testId, best.variantId(), runnerUp.variantId(), pValue, metric, null, stats, suggestions);
    }

    private double compare(String metric, VariantStats a, VariantStats b) {
        if (METRIC_CTR.equals(metric)) {
            return twoProportionPValue(a.conversions(), a.impressions(), b.conversions(), b.impressions());
        }
        return meanDifferencePValue(a.engagementMean(), a.engagementStdDev(), a.engagementCount(),
                b.engagementMean(), b.engagementStdDev(), b.engagementCount());
    }

    private VariantStats toStats(OutcomeMetric m) {
        return new VariantStats(m.getVariantId(), m.getSamples(), m.getImpressions(), m.getConversions(),
                m.getCtr(), m.getEngagementCount(), m.getEngagementMean(), m.getEngagementStdDev());
    }

    /**
     * Two-tailed two-proportion z-test with pooled proportion. Returns 1.0 when either group
     * is empty or the pooled variance is zero.
     */
    public static double twoProportionPValue(long x1, long n1, long x2, long n2) {
        if (n1 <= 0 || n2 <= 0) {
            return 1.0;
        }
        double p1 = (double) x1 / n1;
        double p2 = (double) x2 / n2;
        double pooled = (double) (x1 + x2) / (n1 + n2);
        double denom = Math.sqrt(pooled * (1 - pooled) * (1.0 / n1 + 1.0 / n2));
        if (denom == 0 || Double.isNaN(denom)) {
            return 1.0;
        }
        return NormalDistribution.twoTailedPValue(Math.abs(p1 - p2) / denom);
    }

    /**
     * Welch-style difference of means from summary statistics, with the normal tail standing
     * in for the Student-t distribution.
     */
    public static double meanDifferencePValue(double mean1, double stdDev1, long n1,
                                              double mean2, double stdDev2, long n2) {
        if (n1 <= 0 || n2 <= 0) {
            return 1.0;
        }
        double denom = Math.sqrt(stdDev1 * stdDev1 / n1 + stdDev2 * stdDev2 / n2);
        if (denom == 0 || Double.isNaN(denom)) {
            return 1.0;
        }
        return NormalDistribution.twoTailedPValue(Math.abs(mean1 - mean2) / denom);
    }
}
