package com.social.automation.integration;

import com.social.automation.model.ApprovalEntry;

import java.util.List;

/**
 * Fire-and-forget sink for urgent approval entries. Implementations must not throw.
 */
public interface UrgentApprovalNotifier {

    void notifyUrgent(List<ApprovalEntry> entries);
}
