package com.social.automation.model.action;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RespondConfig implements ActionConfig {

    // Used when the selected variant carries no template of its own
    private String templateRef;

    @Builder.Default
    private String style = "friendly";

    @Override
    public ActionType getActionType() {
        return ActionType.RESPOND;
    }

    @Override
    public void validate() {
        if (style == null || style.isBlank()) {
            throw new RuleDefinitionException("respond action requires a style");
        }
    }
}
