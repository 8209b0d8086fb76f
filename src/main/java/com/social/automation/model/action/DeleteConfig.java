package com.social.automation.model.action;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteConfig implements ActionConfig {

    // Opaque to the engine, handed to the moderation collaborator as-is
    @Builder.Default
    private Map<String, Object> deleteCriteria = new HashMap<>();

    @Override
    public ActionType getActionType() {
        return ActionType.DELETE;
    }

    @Override
    public void validate() {
        if (deleteCriteria == null) {
            throw new RuleDefinitionException("delete action requires deleteCriteria (may be empty)");
        }
    }
}
