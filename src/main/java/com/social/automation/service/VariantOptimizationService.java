package com.social.automation.service;

import com.social.automation.config.AbTestingConfig;
import com.social.automation.config.MetricsConfig;
import com.social.automation.engine.abtest.SignificanceEngine;
import com.social.automation.engine.abtest.Suggestion;
import com.social.automation.engine.abtest.TestAnalysis;
import com.social.automation.model.AutomationRule;
import com.social.automation.model.Variant;
import com.social.automation.model.VariantWeightChange;
import com.social.automation.repository.RuleRepository;
import com.social.automation.repository.VariantWeightHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Feeds significance results back into rule variant weights.
 */
@Service
public class VariantOptimizationService {

    private static final Logger log = LoggerFactory.getLogger(VariantOptimizationService.class);

    private final RuleRepository ruleRepo;
    private final VariantWeightHistoryRepository historyRepo;
    private final SignificanceEngine significanceEngine;
    private final AbTestingConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public VariantOptimizationService(RuleRepository ruleRepo,
                                      VariantWeightHistoryRepository historyRepo,
                                      SignificanceEngine significanceEngine,
                                      AbTestingConfig config,
                                      MetricsConfig metricsConfig,
                                      Clock clock) {
        this.ruleRepo = ruleRepo;
        this.historyRepo = historyRepo;
        this.significanceEngine = significanceEngine;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public Map<String, TestAnalysis> analyze(String ruleId, Integer minSamplesPerVariant) {
        int minSamples = minSamplesPerVariant != null ? minSamplesPerVariant : config.getMinSamplesPerVariant();
        return significanceEngine.calculateWinner(ruleId, minSamples);
    }

    /**
     * Reweight every test of the rule whose winner is significant: the winner gets the
     * configured share, the remaining active variants split the rest equally. With auto-pause
     * enabled, a variant significantly below the best is set to weight 0 (kept, not removed),
     * whether or not the winner itself is significant. Each variant is written at most once
     * per call, so a second call on unchanged data changes nothing.
     */
    public OptimizationResult autoOptimize(String ruleId) {
        AutomationRule rule = ruleRepo.findById(ruleId);
        if (rule == null) {
            return new OptimizationResult(ruleId, false, "rule_not_found", Map.of(), Map.of());
        }
        if (!rule.hasAbTests()) {
            return new OptimizationResult(ruleId, false, "no_tests", Map.of(), Map.of());
        }

        Map<String, TestAnalysis> analysis = analyze(ruleId, null);
        long now = clock.millis();
        List<VariantWeightChange> changes = new ArrayList<>();

        for (TestAnalysis result : analysis.values()) {
            List<Variant> variants = rule.getAbTests().get(result.testId());
            if (variants == null || variants.isEmpty()) {
                continue;
            }

            Map<String, Suggestion> paused = new HashMap<>();
            if (config.isAutoPausePoorVariants()) {
                for (Suggestion suggestion : result.suggestions()) {
                    if (suggestion.type() == Suggestion.Type.PAUSE_VARIANT) {
                        paused.put(suggestion.variantId(), suggestion);
                    }
                }
            }
            boolean significant = result.isSignificant(config.getSignificanceThreshold());
            if (!significant && paused.isEmpty()) {
                continue;
            }

            long activeOthers = variants.stream()
                    .map(Variant::getVariantId)
                    .filter(id -> !id.equals(result.winner()) && !paused.containsKey(id))
                    .count();
            double otherShare = Math.round((1.0 - config.getWinnerWeight())
                    / Math.max(1, activeOthers) * 10_000.0) / 10_000.0;

            for (Variant variant : variants) {
                Suggestion pause = paused.get(variant.getVariantId());
                if (pause != null) {
                    applyWeight(rule, result.testId(), variant, 0.0, "pause", pause.pValue(), now, changes);
                } else if (significant) {
                    boolean winner = variant.getVariantId().equals(result.winner());
                    double target = winner ? config.getWinnerWeight() : otherShare;
                    applyWeight(rule, result.testId(), variant, target, winner ? "winner" : "rebalance",
                            result.pValue(), now, changes);
                }
            }
        }

        if (changes.isEmpty()) {
            return new OptimizationResult(ruleId, false, "no_significant_changes", analysis, rule.getAbTests());
        }

        ruleRepo.save(rule);
        for (VariantWeightChange change : changes) {
            historyRepo.save(change);
            metricsConfig.recordVariantReweight(change.getReason());
        }
        log.info("Rule {} variant weights updated: {} changes", ruleId, changes.size());
        return new OptimizationResult(ruleId, true, null, analysis, rule.getAbTests());
    }

    @Scheduled(fixedRateString = "${automation.ab-testing.optimize-interval-minutes:60}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "5")
    public void optimizeAllRules() {
        int updated = 0;
        List<AutomationRule> candidates = ruleRepo.findAll().stream()
                .filter(AutomationRule::isEnabled)
                .filter(AutomationRule::hasAbTests)
                .toList();
        for (AutomationRule rule : candidates) {
            try {
                if (autoOptimize(rule.getRuleId()).updated()) {
                    updated++;
                }
            } catch (Exception e) {
                log.error("Variant optimization for rule {} failed: {}", rule.getRuleId(), e.getMessage(), e);
            }
        }
        log.info("Variant optimization sweep complete. {} of {} rules reweighted.", updated, candidates.size());
    }

    private void applyWeight(AutomationRule rule, String testId, Variant variant, double target,
                             String reason, Double pValue, long now, List<VariantWeightChange> changes) {
        double old = variant.getWeight();
        if (Math.abs(old - target) < 1e-9) {
            return;
        }
        variant.setWeight(target);
        changes.add(VariantWeightChange.builder()
                .ruleId(rule.getRuleId())
                .testId(testId)
                .variantId(variant.getVariantId())
                .oldWeight(old)
                .newWeight(target)
                .reason(reason)
                .pValue(pValue != null ? pValue : 1.0)
                .adjustedAt(now)
                .build());
    }
}
