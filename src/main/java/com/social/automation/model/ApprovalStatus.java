package com.social.automation.model;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    AUTO_APPROVED,
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
