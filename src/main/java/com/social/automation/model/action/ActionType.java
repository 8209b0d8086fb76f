package com.social.automation.model.action;

public enum ActionType {
    RESPOND,
    DELETE,
    FLAG
}
