package com.social.automation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningEvent {
    private String eventType;           // approval, auto_approval, rejection
    private String approvalId;
    private String scopeId;
    private String ruleId;
    private String variantKey;
    private int priority;
    private String actor;
    private String reason;
    private long createdAt;
}
