package com.social.automation.model.action;

/**
 * Thrown when a rule definition cannot be executed as written.
 */
public class RuleDefinitionException extends RuntimeException {

    public RuleDefinitionException(String message) {
        super(message);
    }
}
