package com.social.automation.service;

import com.social.automation.model.AutomationRule;
import com.social.automation.repository.RuleRepository;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Service layer for managing automation rules.
 * Writes go through {@link AutomationRule#validate()} in the repository, so invalid
 * definitions surface as {@link com.social.automation.model.action.RuleDefinitionException}.
 */
@Service
public class RuleService {

    private final RuleRepository ruleRepository;
    private final Clock clock;

    public RuleService(RuleRepository ruleRepository, Clock clock) {
        this.ruleRepository = ruleRepository;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        ruleRepository.refreshCache();
    }

    public List<AutomationRule> getAllRules() {
        return ruleRepository.findAll();
    }

    public AutomationRule getRule(String ruleId) {
        return ruleRepository.findById(ruleId);
    }

    public AutomationRule createRule(AutomationRule rule) {
        if (rule.getRuleId() == null || rule.getRuleId().isEmpty()) {
            rule.setRuleId(UUID.randomUUID().toString());
        }
        if (rule.getCreatedAt() == 0) {
            rule.setCreatedAt(clock.millis());
        }
        ruleRepository.save(rule);
        return rule;
    }

    public AutomationRule updateRule(String ruleId, AutomationRule updated) {
        AutomationRule existing = ruleRepository.findById(ruleId);
        if (existing == null) {
            return null;
        }

        if (updated.getName() != null) existing.setName(updated.getName());
        if (updated.getScopeId() != null) existing.setScopeId(updated.getScopeId());
        if (updated.getCondition() != null) existing.setCondition(updated.getCondition());
        if (updated.getAction() != null) existing.setAction(updated.getAction());
        if (updated.getAbTests() != null) existing.setAbTests(updated.getAbTests());
        existing.setPriority(updated.getPriority());
        existing.setEnabled(updated.isEnabled());
        existing.setResponseLimitPerRun(updated.getResponseLimitPerRun());
        existing.setRequireApproval(updated.isRequireApproval());

        ruleRepository.save(existing);
        return existing;
    }

    public boolean deleteRule(String ruleId) {
        return ruleRepository.delete(ruleId);
    }
}
