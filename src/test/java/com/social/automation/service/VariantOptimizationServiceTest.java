package com.social.automation.service;

import com.social.automation.config.AbTestingConfig;
import com.social.automation.config.MetricsConfig;
import com.social.automation.engine.abtest.SignificanceEngine;
import com.social.automation.model.AutomationRule;
import com.social.automation.model.Variant;
import com.social.automation.model.VariantWeightChange;
import com.social.automation.repository.OutcomeMetricRepository;
import com.social.automation.repository.RuleRepository;
import com.social.automation.repository.VariantWeightHistoryRepository;
import com.social.automation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VariantOptimizationServiceTest {

    @Mock private RuleRepository ruleRepo;
    @Mock private VariantWeightHistoryRepository historyRepo;
    @Mock private OutcomeMetricRepository outcomeRepo;
    @Mock private MetricsConfig metricsConfig;

    private AbTestingConfig config;
    private VariantOptimizationService service;

    @BeforeEach
    void setUp() {
        config = new AbTestingConfig();
        config.setMinSamplesPerVariant(50);
        config.setWinnerWeight(0.7);
        service = new VariantOptimizationService(ruleRepo, historyRepo, new SignificanceEngine(outcomeRepo, config),
                config, metricsConfig, Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC));
    }

    private AutomationRule ruleWithTest() {
        AutomationRule rule = TestDataFactory.createRespondRule("R-1", 1, "thanks");
        rule.setAbTests(TestDataFactory.abTest("t1", 0.5, 0.5));
        return rule;
    }

    private double weightOf(AutomationRule rule, String variantId) {
        return rule.getAbTests().get("t1").stream()
                .filter(v -> v.getVariantId().equals(variantId))
                .mapToDouble(Variant::getWeight)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void autoOptimize_significantWinner_reweightsAndRecordsHistory() {
        AutomationRule rule = ruleWithTest();
        when(ruleRepo.findById("R-1")).thenReturn(rule);
        when(outcomeRepo.findByRule("R-1")).thenReturn(List.of(
                TestDataFactory.createCtrMetric("R-1", "t1", "A", 1000, 500),
                TestDataFactory.createCtrMetric("R-1", "t1", "B", 1000, 400)));

        OptimizationResult result = service.autoOptimize("R-1");

        assertThat(result.updated()).isTrue();
        assertThat(weightOf(rule, "A")).isEqualTo(0.7);
        assertThat(weightOf(rule, "B")).isEqualTo(0.3);
        verify(ruleRepo).save(rule);
        ArgumentCaptor<VariantWeightChange> changes = ArgumentCaptor.forClass(VariantWeightChange.class);
        verify(historyRepo, times(2)).save(changes.capture());
        assertThat(changes.getAllValues()).extracting(VariantWeightChange::getReason)
                .containsExactly("winner", "rebalance");
    }

    @Test
    void autoOptimize_autoPauseEnabled_zeroesLaggingVariant() {
        config.setAutoPausePoorVariants(true);
        AutomationRule rule = TestDataFactory.createRespondRule("R-1", 1, "thanks");
        rule.getAbTests().put("t1", new ArrayList<>(List.of(
                Variant.builder().variantId("A").weight(0.34).build(),
                Variant.builder().variantId("B").weight(0.33).build(),
                Variant.builder().variantId("C").weight(0.33).build())));
        when(ruleRepo.findById("R-1")).thenReturn(rule);
        when(outcomeRepo.findByRule("R-1")).thenReturn(List.of(
                TestDataFactory.createCtrMetric("R-1", "t1", "A", 1000, 500),
                TestDataFactory.createCtrMetric("R-1", "t1", "B", 1000, 495),
                TestDataFactory.createCtrMetric("R-1", "t1", "C", 1000, 400)));

        OptimizationResult result = service.autoOptimize("R-1");

        assertThat(result.updated()).isTrue();
        assertThat(weightOf(rule, "C")).isZero();
        assertThat(weightOf(rule, "A")).isEqualTo(0.34);
        verify(metricsConfig).recordVariantReweight("pause");
    }

    @Test
    void autoOptimize_pausedRunnerUp_settlesAfterFirstSweep() {
        config.setAutoPausePoorVariants(true);
        AutomationRule rule = ruleWithTest();
        when(ruleRepo.findById("R-1")).thenReturn(rule);
        when(outcomeRepo.findByRule("R-1")).thenReturn(List.of(
                TestDataFactory.createCtrMetric("R-1", "t1", "A", 1000, 500),
                TestDataFactory.createCtrMetric("R-1", "t1", "B", 1000, 400)));

        OptimizationResult first = service.autoOptimize("R-1");
        OptimizationResult second = service.autoOptimize("R-1");

        assertThat(first.updated()).isTrue();
        assertThat(weightOf(rule, "A")).isEqualTo(0.7);
        assertThat(weightOf(rule, "B")).isZero();
        assertThat(second.updated()).isFalse();
        assertThat(second.reason()).isEqualTo("no_significant_changes");
        verify(ruleRepo, times(1)).save(rule);
        ArgumentCaptor<VariantWeightChange> changes = ArgumentCaptor.forClass(VariantWeightChange.class);
        verify(historyRepo, times(2)).save(changes.capture());
        assertThat(changes.getAllValues()).extracting(VariantWeightChange::getReason)
                .containsExactly("winner", "pause");
    }

    @Test
    void autoOptimize_significantWinnerWithPausedVariant_splitsRemainderAmongActive() {
        config.setAutoPausePoorVariants(true);
        AutomationRule rule = TestDataFactory.createRespondRule("R-1", 1, "thanks");
        rule.getAbTests().put("t1", new ArrayList<>(List.of(
                Variant.builder().variantId("A").weight(0.34).build(),
                Variant.builder().variantId("B").weight(0.33).build(),
                Variant.builder().variantId("C").weight(0.33).build())));
        when(ruleRepo.findById("R-1")).thenReturn(rule);
        when(outcomeRepo.findByRule("R-1")).thenReturn(List.of(
                TestDataFactory.createCtrMetric("R-1", "t1", "A", 1000, 600),
                TestDataFactory.createCtrMetric("R-1", "t1", "B", 1000, 500),
                TestDataFactory.createCtrMetric("R-1", "t1", "C", 1000, 400)));

        service.autoOptimize("R-1");

        assertThat(weightOf(rule, "A")).isEqualTo(0.7);
        assertThat(weightOf(rule, "B")).isEqualTo(0.3);
        assertThat(weightOf(rule, "C")).isZero();
    }

    @Test
    void autoOptimize_inconclusive_leavesWeights() {
        AutomationRule rule = ruleWithTest();
        when(ruleRepo.findById("R-1")).thenReturn(rule);
        when(outcomeRepo.findByRule("R-1")).thenReturn(List.of(
                TestDataFactory.createCtrMetric("R-1", "t1", "A", 1000, 505),
                TestDataFactory.createCtrMetric("R-1", "t1", "B", 1000, 495)));

        OptimizationResult result = service.autoOptimize("R-1");

        assertThat(result.updated()).isFalse();
        assertThat(result.reason()).isEqualTo("no_significant_changes");
        verify(ruleRepo, never()).save(any());
        verifyNoInteractions(historyRepo);
    }

    @Test
    void autoOptimize_unknownRuleOrNoTests() {
        when(ruleRepo.findById("MISSING")).thenReturn(null);
        when(ruleRepo.findById("R-PLAIN")).thenReturn(TestDataFactory.createRespondRule("R-PLAIN", 1, "thanks"));

        assertThat(service.autoOptimize("MISSING").reason()).isEqualTo("rule_not_found");
        assertThat(service.autoOptimize("R-PLAIN").reason()).isEqualTo("no_tests");
    }

    @Test
    void optimizeAllRules_failingRuleDoesNotStopSweep() {
        AutomationRule broken = ruleWithTest();
        broken.setRuleId("R-BROKEN");
        AutomationRule good = ruleWithTest();
        when(ruleRepo.findAll()).thenReturn(List.of(broken, good));
        when(ruleRepo.findById("R-BROKEN")).thenThrow(new RuntimeException("timeout"));
        when(ruleRepo.findById("R-1")).thenReturn(good);
        when(outcomeRepo.findByRule("R-1")).thenReturn(List.of(
                TestDataFactory.createCtrMetric("R-1", "t1", "A", 1000, 500),
                TestDataFactory.createCtrMetric("R-1", "t1", "B", 1000, 400)));

        service.optimizeAllRules();

        verify(ruleRepo).save(good);
    }
}
