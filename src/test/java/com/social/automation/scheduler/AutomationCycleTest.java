package com.social.automation.scheduler;

import com.social.automation.config.AutomationConfig;
import com.social.automation.config.MetricsConfig;
import com.social.automation.engine.RuleEngine;
import com.social.automation.engine.ScopeRunResult;
import com.social.automation.repository.RuleRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutomationCycleTest {

    @Mock private RuleEngine ruleEngine;
    @Mock private RuleRepository ruleRepository;
    @Mock private MetricsConfig metricsConfig;

    private AutomationCycle cycle;

    @BeforeEach
    void setUp() {
        AutomationConfig config = new AutomationConfig();
        config.getCycle().setEnabled(false);
        config.getCycle().setWorkerThreads(4);
        cycle = new AutomationCycle(ruleEngine, ruleRepository, config, metricsConfig);
    }

    @AfterEach
    void tearDown() {
        cycle.onStop();
    }

    private static ScopeRunResult result(String scopeId, int executed) {
        return new ScopeRunResult(scopeId, executed, executed, Map.of(), null);
    }

    @Test
    void runOnce_reloadsRulesAndRunsEveryScope() {
        when(ruleRepository.getScopesWithEnabledRules()).thenReturn(new LinkedHashSet<>(List.of("CH-1", "CH-2")));
        when(ruleEngine.runScope("CH-1")).thenReturn(result("CH-1", 2));
        when(ruleEngine.runScope("CH-2")).thenReturn(result("CH-2", 1));

        List<ScopeRunResult> results = cycle.runOnce();

        verify(ruleRepository).refreshCache();
        assertThat(results).extracting(ScopeRunResult::scopeId).containsExactlyInAnyOrder("CH-1", "CH-2");
    }

    @Test
    void runOnce_failingScopeIsIsolated() {
        when(ruleRepository.getScopesWithEnabledRules()).thenReturn(Set.of("CH-BAD", "CH-OK"));
        when(ruleEngine.runScope("CH-BAD")).thenThrow(new RuntimeException("store unavailable"));
        when(ruleEngine.runScope("CH-OK")).thenReturn(result("CH-OK", 1));

        List<ScopeRunResult> results = cycle.runOnce();

        assertThat(results).extracting(ScopeRunResult::scopeId).containsExactly("CH-OK");
        verify(metricsConfig).recordScopeFailure("automation");
    }

    @Test
    void runOnce_noScopesDoesNothing() {
        when(ruleRepository.getScopesWithEnabledRules()).thenReturn(Set.of());

        assertThat(cycle.runOnce()).isEmpty();
        verifyNoInteractions(ruleEngine);
    }

    @Test
    void runOnce_scopeStillRunningIsSkippedByOverlappingCycle() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(ruleRepository.getScopesWithEnabledRules()).thenReturn(Set.of("CH-1"));
        when(ruleEngine.runScope("CH-1")).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return result("CH-1", 1);
        });

        CompletableFuture<List<ScopeRunResult>> first = CompletableFuture.supplyAsync(cycle::runOnce);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        List<ScopeRunResult> overlapping = cycle.runOnce();
        release.countDown();

        assertThat(overlapping).isEmpty();
        assertThat(first.get(5, TimeUnit.SECONDS)).hasSize(1);
        verify(ruleEngine, times(1)).runScope("CH-1");
    }

    @Test
    void scheduledAndManualCycles_areBothTimed() {
        when(ruleRepository.getScopesWithEnabledRules()).thenReturn(Set.of("CH-1"));
        when(ruleEngine.runScope("CH-1")).thenReturn(result("CH-1", 1));

        cycle.tick();
        cycle.runOnce();

        verify(metricsConfig).recordCycle(eq("scheduled"), eq(1), anyLong());
        verify(metricsConfig).recordCycle(eq("manual"), eq(1), anyLong());
    }

    @Test
    void runOnce_afterStop_startsFreshWorkers() {
        when(ruleRepository.getScopesWithEnabledRules()).thenReturn(Set.of("CH-1"));
        when(ruleEngine.runScope("CH-1")).thenReturn(result("CH-1", 1));

        assertThat(cycle.runOnce()).hasSize(1);
        cycle.onStop();

        assertThat(cycle.runOnce()).extracting(ScopeRunResult::scopeId).containsExactly("CH-1");
        verify(ruleEngine, times(2)).runScope("CH-1");
    }
}
