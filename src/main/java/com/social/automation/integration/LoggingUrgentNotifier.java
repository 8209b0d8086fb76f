package com.social.automation.integration;

import com.social.automation.model.ApprovalEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(0)
public class LoggingUrgentNotifier implements UrgentApprovalNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingUrgentNotifier.class);

    @Override
    public void notifyUrgent(List<ApprovalEntry> entries) {
        for (ApprovalEntry entry : entries) {
            log.warn("Urgent approval needed: approval={}, scope={}, item={}, priority={}",
                    entry.getApprovalId(), entry.getScopeId(), entry.getItemId(), entry.getPriority());
        }
    }
}
