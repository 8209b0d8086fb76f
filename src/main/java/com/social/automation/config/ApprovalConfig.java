package com.social.automation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "automation.approval")
public class ApprovalConfig {
    private int urgentPriorityThreshold = 90;
    private int autoApproveAfterMinutes = 60;            // 0 = never auto-approve
    private int sweepIntervalSeconds = 60;
    private boolean sweepEnabled = true;
}
