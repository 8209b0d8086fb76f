package com.social.automation.model.action;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Action a rule performs when it matches. Serialized with a {@code type}
 * discriminator so the stored JSON bin round-trips to the concrete config.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RespondConfig.class, name = "respond"),
        @JsonSubTypes.Type(value = DeleteConfig.class, name = "delete"),
        @JsonSubTypes.Type(value = FlagConfig.class, name = "flag")
})
public interface ActionConfig {

    @JsonIgnore
    ActionType getActionType();

    /**
     * Reject configurations that cannot be executed.
     *
     * @throws RuleDefinitionException if the configuration is invalid
     */
    void validate();
}
