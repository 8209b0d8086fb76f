package com.social.automation.model;

public enum ExecutionOutcome {
    EXECUTED,
    QUEUED_FOR_APPROVAL,
    DECLINED,
    RATE_LIMITED,
    FAILED;

    /**
     * Whether the execution counts toward the per-run cap.
     */
    public boolean isSuccess() {
        return this == EXECUTED || this == QUEUED_FOR_APPROVAL;
    }
}
