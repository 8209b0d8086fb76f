package com.social.automation.model;

import com.social.automation.model.action.ActionConfig;
import com.social.automation.model.action.ActionType;
import com.social.automation.model.action.RuleDefinitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Automation policy scoped to one source")
public class AutomationRule {

    @Schema(description = "Unique rule identifier", example = "RULE-REFUND-FLAG")
    private String ruleId;

    @Schema(description = "Scope the rule applies to", example = "CH-001")
    private String scopeId;

    @Schema(description = "Display name", example = "Flag refund requests")
    private String name;

    @Schema(description = "Higher priority rules are evaluated first", example = "10")
    private int priority;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private RuleCondition condition = new RuleCondition();

    @Schema(description = "Action descriptor, discriminated by `type` (respond, delete, flag)")
    private ActionConfig action;

    @Schema(description = "Max executions per automation run; 0 = no rule-specific limit", example = "20")
    private int responseLimitPerRun;

    @Schema(description = "Whether responses must pass through the approval queue")
    private boolean requireApproval;

    @Schema(description = "Embedded A/B tests: test id -> variants. The first test is the default.")
    @Builder.Default
    private Map<String, List<Variant>> abTests = new LinkedHashMap<>();

    private long createdAt;

    @JsonIgnore
    public ActionType getActionType() {
        return action != null ? action.getActionType() : null;
    }

    @JsonIgnore
    public boolean hasAbTests() {
        return abTests != null && !abTests.isEmpty();
    }

    /**
     * Validates the rule as loaded from storage or received from an operator.
     *
     * @throws RuleDefinitionException when the rule cannot be executed
     */
    public void validate() {
        if (ruleId == null || ruleId.isBlank()) {
            throw new RuleDefinitionException("ruleId is required");
        }
        if (scopeId == null || scopeId.isBlank()) {
            throw new RuleDefinitionException("scopeId is required for rule " + ruleId);
        }
        if (action == null) {
            throw new RuleDefinitionException("action is required for rule " + ruleId);
        }
        if (responseLimitPerRun < 0) {
            throw new RuleDefinitionException("responseLimitPerRun must not be negative");
        }
        action.validate();
        if (abTests != null) {
            for (Map.Entry<String, List<Variant>> test : abTests.entrySet()) {
                if (test.getValue() == null) continue;
                for (Variant variant : test.getValue()) {
                    if (variant.getVariantId() == null || variant.getVariantId().isBlank()) {
                        throw new RuleDefinitionException("variant without id in test " + test.getKey());
                    }
                    double weight = variant.getWeight();
                    if (Double.isNaN(weight) || weight < 0 || weight > 1) {
                        throw new RuleDefinitionException("weight for variant "
                                + test.getKey() + VariantKey.SEPARATOR + variant.getVariantId()
                                + " must be in [0, 1], got " + weight);
                    }
                }
            }
        }
    }
}
