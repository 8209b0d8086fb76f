package com.social.automation.scheduler;

import com.social.automation.config.ApprovalConfig;
import com.social.automation.service.ApprovalQueueService;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Auto-approves timed-out entries on its own tick, independent of the automation cycle.
 */
@Component
public class ApprovalExpirySweep extends PeriodicTask {

    private final ApprovalQueueService approvalQueueService;

    public ApprovalExpirySweep(ApprovalQueueService approvalQueueService, ApprovalConfig approvalConfig) {
        super("approval-expiry-sweep",
                Duration.ofSeconds(approvalConfig.getSweepIntervalSeconds()),
                Duration.ofSeconds(30),
                approvalConfig.isSweepEnabled());
        this.approvalQueueService = approvalQueueService;
    }

    @Override
    public void tick() {
        approvalQueueService.autoApproveExpired();
    }
}
