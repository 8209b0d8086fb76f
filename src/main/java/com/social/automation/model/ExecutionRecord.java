package com.social.automation.model;

import com.social.automation.model.action.ActionType;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Append-only log entry for one action execution attempt")
public class ExecutionRecord {
    private String executionId;
    private String ruleId;              // null for executions outside a rule
    private String itemId;
    private String scopeId;
    private ActionType actionType;
    private String actionJson;          // action descriptor as stored on the rule
    private String variantKey;          // testId::variantId, respond only
    private ExecutionOutcome outcome;
    private String detail;              // decline reason or error message
    private Map<String, String> context;
    private long durationMs;
    private long executedAt;

    public boolean isSuccess() {
        return outcome != null && outcome.isSuccess();
    }
}
