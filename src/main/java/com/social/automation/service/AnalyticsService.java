package com.social.automation.service;

import com.social.automation.config.AbTestingConfig;
import com.social.automation.config.AnalyticsConfig;
import com.social.automation.engine.abtest.SignificanceEngine;
import com.social.automation.engine.abtest.Suggestion;
import com.social.automation.engine.abtest.TestAnalysis;
import com.social.automation.model.AutomationRule;
import com.social.automation.model.DailyRuleOutcome;
import com.social.automation.model.analytics.AutomationComparison;
import com.social.automation.model.analytics.BestWorstReport;
import com.social.automation.model.analytics.CtrAnomaly;
import com.social.automation.model.analytics.RoiReport;
import com.social.automation.model.analytics.RulePerformance;
import com.social.automation.model.analytics.RuleSuggestion;
import com.social.automation.model.analytics.WeeklyReport;
import com.social.automation.repository.DailyOutcomeRepository;
import com.social.automation.repository.RuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read-only analytics over the daily per-rule outcome buckets.
 */
@Service
public class AnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    static final int TRAILING_DAYS = 7;

    /** best first: CTR, then mean engagement, then rule id */
    static final Comparator<RulePerformance> RANKING =
            Comparator.comparingDouble(RulePerformance::getCtr).reversed()
                    .thenComparing(Comparator.comparingDouble(RulePerformance::getEngagementMean).reversed())
                    .thenComparing(RulePerformance::getRuleId);

    private final DailyOutcomeRepository dailyOutcomeRepo;
    private final RuleRepository ruleRepository;
    private final SignificanceEngine significanceEngine;
    private final AnalyticsConfig config;
    private final AbTestingConfig abTestingConfig;
    private final Clock clock;

    public AnalyticsService(DailyOutcomeRepository dailyOutcomeRepo,
                            RuleRepository ruleRepository,
                            SignificanceEngine significanceEngine,
                            AnalyticsConfig config,
                            AbTestingConfig abTestingConfig,
                            Clock clock) {
        this.dailyOutcomeRepo = dailyOutcomeRepo;
        this.ruleRepository = ruleRepository;
        this.significanceEngine = significanceEngine;
        this.config = config;
        this.abTestingConfig = abTestingConfig;
        this.clock = clock;
    }

    public BestWorstReport getBestWorstRules(Integer windowDays, Integer topN) {
        int window = windowDays != null ? windowDays : config.getWindowDays();
        int n = topN != null ? topN : config.getTopN();

        List<DailyRuleOutcome> buckets = dailyOutcomeRepo.findSince(null, today().minusDays(window - 1L)).stream()
                .filter(DailyRuleOutcome::isAutomated)
                .toList();
        List<RulePerformance> ranked = aggregateByRule(buckets, ruleNames()).stream()
                .filter(p -> p.getImpressions() > 0 || p.getEngagementMean() > 0)
                .sorted(RANKING)
                .toList();

        List<RulePerformance> best = ranked.stream().limit(n).toList();
        List<RulePerformance> worst = new ArrayList<>(ranked);
        Collections.reverse(worst);
        return new BestWorstReport(window, best, worst.stream().limit(n).toList());
    }

    /**
     * Flags days within the lookback whose CTR differs from the mean of the previous seven
     * data points by at least the anomaly threshold (fractional change).
     */
    public List<CtrAnomaly> detectCtrAnomalies(String ruleId, Integer lookbackDays) {
        int lookback = lookbackDays != null ? lookbackDays : config.getLookbackDays();
        LocalDate today = today();
        LocalDate flagFrom = today.minusDays(lookback - 1L);

        Map<String, TreeMap<LocalDate, long[]>> series = new TreeMap<>();
        for (DailyRuleOutcome bucket : dailyOutcomeRepo.findSince(ruleId, flagFrom.minusDays(TRAILING_DAYS))) {
            if (!bucket.isAutomated()) continue;
            long[] counts = series.computeIfAbsent(bucket.getRuleId(), k -> new TreeMap<>())
                    .computeIfAbsent(bucket.getDay(), k -> new long[2]);
            counts[0] += bucket.getImpressions();
            counts[1] += bucket.getConversions();
        }

        List<CtrAnomaly> anomalies = new ArrayList<>();
        for (Map.Entry<String, TreeMap<LocalDate, long[]>> rule : series.entrySet()) {
            List<Map.Entry<LocalDate, long[]>> points = new ArrayList<>(rule.getValue().entrySet());
            if (points.size() < TRAILING_DAYS + 1) continue;

            for (int i = TRAILING_DAYS; i < points.size(); i++) {
                LocalDate day = points.get(i).getKey();
                if (day.isBefore(flagFrom)) continue;

                double current = ctr(points.get(i).getValue());
                double trailingMean = points.subList(i - TRAILING_DAYS, i).stream()
                        .mapToDouble(p -> ctr(p.getValue()))
                        .average()
                        .orElse(0.0);
                double change = relativeChange(current, trailingMean);
                if (Math.abs(change) >= config.getAnomalyThreshold()) {
                    anomalies.add(new CtrAnomaly(rule.getKey(), day, round(current, 4), round(trailingMean, 4),
                            round(change, 4), change > 0 ? "spike" : "drop"));
                }
            }
        }
        log.debug("CTR anomaly scan over {} rules found {} anomalies", series.size(), anomalies.size());
        return anomalies;
    }

    public RoiReport calculateRoi(String ruleId, Integer windowDays) {
        int window = windowDays != null ? windowDays : config.getWindowDays();
        long responses = dailyOutcomeRepo.findSince(ruleId, today().minusDays(window - 1L)).stream()
                .filter(DailyRuleOutcome::isAutomated)
                .mapToLong(DailyRuleOutcome::getResponses)
                .sum();
        return roi(ruleId, window, responses);
    }

    RoiReport roi(String ruleId, int window, long responses) {
        double hoursSaved = responses * (double) config.getSecondsPerManualResponse() / 3600.0;
        double laborValue = hoursSaved * config.getHourlyRate();
        double cost = responses * config.getCostPerResponse();
        return new RoiReport(ruleId, window, responses, round(hoursSaved, 2), round(laborValue, 2),
                round(cost, 2), round(laborValue - cost, 2));
    }

    public AutomationComparison compareAutomatedVsManual(String ruleId, Integer windowDays) {
        int window = windowDays != null ? windowDays : config.getWindowDays();
        List<DailyRuleOutcome> buckets = dailyOutcomeRepo.findSince(ruleId, today().minusDays(window - 1L));
        String name = ruleNames().get(ruleId);

        RulePerformance automated = aggregate(ruleId, name,
                buckets.stream().filter(DailyRuleOutcome::isAutomated).toList());
        RulePerformance manual = aggregate(ruleId, name,
                buckets.stream().filter(b -> !b.isAutomated()).toList());
        return new AutomationComparison(ruleId, window, automated, manual,
                round(automated.getCtr() - manual.getCtr(), 4),
                round(automated.getEngagementMean() - manual.getEngagementMean(), 4));
    }

    /**
     * One report per ISO week, most recent first, covering the current week and the
     * {@code weeks - 1} before it.
     */
    public List<WeeklyReport> getWeeklyReports(int weeks) {
        LocalDate currentWeekStart = today().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        LocalDate from = currentWeekStart.minusWeeks(Math.max(1, weeks) - 1L);
        Map<String, String> names = ruleNames();

        Map<LocalDate, List<DailyRuleOutcome>> byWeek = dailyOutcomeRepo.findSince(null, from).stream()
                .filter(DailyRuleOutcome::isAutomated)
                .collect(Collectors.groupingBy(
                        b -> b.getDay().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)),
                        TreeMap::new, Collectors.toList()));

        List<WeeklyReport> reports = new ArrayList<>();
        for (LocalDate weekStart = currentWeekStart; !weekStart.isBefore(from); weekStart = weekStart.minusWeeks(1)) {
            List<RulePerformance> rules = aggregateByRule(byWeek.getOrDefault(weekStart, List.of()), names);
            rules.sort(RANKING);
            RulePerformance best = rules.isEmpty() ? null : rules.get(0);
            RulePerformance worst = rules.isEmpty() ? null : rules.get(rules.size() - 1);
            reports.add(new WeeklyReport(isoWeek(weekStart), weekStart, rules, best, worst));
        }
        return reports;
    }

    /**
     * A/B suggestions from significance testing of every enabled rule with embedded tests,
     * followed by a CTR-drop suggestion for each rule with a recent drop anomaly.
     */
    public List<RuleSuggestion> getSuggestions() {
        List<RuleSuggestion> suggestions = new ArrayList<>();
        for (AutomationRule rule : ruleRepository.findAll()) {
            if (!rule.isEnabled() || !rule.hasAbTests()) continue;
            try {
                Map<String, TestAnalysis> analysis = significanceEngine.calculateWinner(
                        rule.getRuleId(), abTestingConfig.getMinSamplesPerVariant());
                for (TestAnalysis test : analysis.values()) {
                    for (Suggestion s : test.suggestions()) {
                        suggestions.add(new RuleSuggestion(rule.getRuleId(), s.type().name().toLowerCase(),
                                s.testId(), s.variantId(), s.pValue(), s.detail()));
                    }
                }
            } catch (Exception e) {
                log.warn("Significance analysis failed for rule {}: {}", rule.getRuleId(), e.getMessage());
            }
        }

        Map<String, CtrAnomaly> latestDrops = new TreeMap<>();
        for (CtrAnomaly anomaly : detectCtrAnomalies(null, null)) {
            if ("drop".equals(anomaly.direction())) {
                latestDrops.merge(anomaly.ruleId(), anomaly, (a, b) -> a.day().isAfter(b.day()) ? a : b);
            }
        }
        for (CtrAnomaly drop : latestDrops.values()) {
            suggestions.add(new RuleSuggestion(drop.ruleId(), "investigate_ctr_drop", null, null, null,
                    String.format("CTR %.4f on %s vs trailing mean %.4f", drop.ctr(), drop.day(), drop.trailingMean())));
        }
        return suggestions;
    }

    static double relativeChange(double current, double trailingMean) {
        if (trailingMean <= 0) {
            return current > 0 ? 1.0 : 0.0;
        }
        return (current - trailingMean) / Math.max(1e-6, trailingMean);
    }

    private List<RulePerformance> aggregateByRule(List<DailyRuleOutcome> buckets, Map<String, String> names) {
        Map<String, List<DailyRuleOutcome>> byRule = buckets.stream()
                .collect(Collectors.groupingBy(DailyRuleOutcome::getRuleId, TreeMap::new, Collectors.toList()));
        List<RulePerformance> results = new ArrayList<>();
        byRule.forEach((ruleId, rows) -> results.add(aggregate(ruleId, names.get(ruleId), rows)));
        return results;
    }

    private RulePerformance aggregate(String ruleId, String name, List<DailyRuleOutcome> rows) {
        long responses = 0, impressions = 0, conversions = 0, engCount = 0;
        double engSum = 0;
        for (DailyRuleOutcome row : rows) {
            responses += row.getResponses();
            impressions += row.getImpressions();
            conversions += row.getConversions();
            engCount += row.getEngagementCount();
            engSum += row.getEngagementSum();
        }
        return RulePerformance.builder()
                .ruleId(ruleId)
                .ruleName(name)
                .responses(responses)
                .impressions(impressions)
                .conversions(conversions)
                .ctr(impressions > 0 ? round((double) conversions / impressions, 4) : 0.0)
                .engagementMean(engCount > 0 ? round(engSum / engCount, 4) : 0.0)
                .build();
    }

    private Map<String, String> ruleNames() {
        return ruleRepository.findAll().stream()
                .filter(r -> r.getName() != null)
                .collect(Collectors.toMap(AutomationRule::getRuleId, AutomationRule::getName, (a, b) -> a));
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    private static String isoWeek(LocalDate day) {
        return String.format("%d-W%02d", day.get(IsoFields.WEEK_BASED_YEAR), day.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    private static double ctr(long[] counts) {
        return counts[0] > 0 ? (double) counts[1] / counts[0] : 0.0;
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
