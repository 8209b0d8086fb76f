package com.social.automation.model;

/**
 * Lifecycle of a {@link QueuedItem}. {@code DONE} is terminal.
 */
public enum ItemStatus {
    PENDING,
    PROCESSING,
    NEEDS_REVIEW,
    DONE
}
