package com.social.automation.service;

import com.social.automation.model.ApprovalEntry;

/**
 * Published once per entry that reached {@code APPROVED} or {@code AUTO_APPROVED}.
 */
public record ApprovalGrantedEvent(ApprovalEntry entry) {}
