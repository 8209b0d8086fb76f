package com.social.automation.model.action;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlagConfig implements ActionConfig {

    private String reason;

    @Override
    public ActionType getActionType() {
        return ActionType.FLAG;
    }

    @Override
    public void validate() {
        // nothing to check
    }
}
