package com.social.automation.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A proposed action waiting for human sign-off")
public class ApprovalEntry {
    private String approvalId;
    private String scopeId;
    private String itemId;
    private String responseId;
    private String ruleId;
    private String variantKey;
    private Map<String, Object> payload;
    private int priority;
    private ApprovalStatus status;
    private long createdAt;
    private long updatedAt;
    private long autoApproveAfter;      // 0 = never auto-approve
    private String approvedBy;          // operator ID or "SYSTEM" for auto-approval
    private long approvedAt;
    private String reason;
    private boolean urgent;
}
