package com.social.automation.service;

import com.social.automation.model.AutomationRule;
import com.social.automation.model.action.RuleDefinitionException;
import com.social.automation.repository.RuleRepository;
import com.social.automation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuleServiceTest {

    @Mock private RuleRepository ruleRepository;

    private RuleService service;

    @BeforeEach
    void setUp() {
        service = new RuleService(ruleRepository, Clock.fixed(Instant.ofEpochMilli(42_000L), ZoneOffset.UTC));
    }

    @Test
    void createRule_assignsIdAndCreationTime() {
        AutomationRule rule = TestDataFactory.createRespondRule(null, 1, "thanks");

        AutomationRule created = service.createRule(rule);

        assertThat(created.getRuleId()).isNotBlank();
        assertThat(created.getCreatedAt()).isEqualTo(42_000L);
        verify(ruleRepository).save(rule);
    }

    @Test
    void createRule_invalidDefinitionPropagates() {
        AutomationRule rule = TestDataFactory.createRespondRule("R-1", 1, "thanks");
        doThrow(new RuleDefinitionException("bad weights")).when(ruleRepository).save(rule);

        assertThatThrownBy(() -> service.createRule(rule)).isInstanceOf(RuleDefinitionException.class);
    }

    @Test
    void updateRule_mergesOntoExisting() {
        AutomationRule existing = TestDataFactory.createRespondRule("R-1", 1, "thanks");
        existing.setCreatedAt(1_000L);
        when(ruleRepository.findById("R-1")).thenReturn(existing);

        AutomationRule patch = AutomationRule.builder().priority(20).enabled(false).responseLimitPerRun(5).build();
        patch.setCondition(null);
        AutomationRule result = service.updateRule("R-1", patch);

        assertThat(result.getPriority()).isEqualTo(20);
        assertThat(result.isEnabled()).isFalse();
        assertThat(result.getResponseLimitPerRun()).isEqualTo(5);
        assertThat(result.getName()).isEqualTo("Respond R-1");
        assertThat(result.getAction()).isNotNull();
        assertThat(result.getCondition()).isNotNull();
        assertThat(result.getCreatedAt()).isEqualTo(1_000L);
    }

    @Test
    void updateRule_unknownReturnsNull() {
        when(ruleRepository.findById("MISSING")).thenReturn(null);

        assertThat(service.updateRule("MISSING", new AutomationRule())).isNull();
        verify(ruleRepository, never()).save(any());
    }
}
