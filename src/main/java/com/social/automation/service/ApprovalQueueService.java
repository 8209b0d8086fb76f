package com.social.automation.service;

import com.social.automation.config.ApprovalConfig;
import com.social.automation.config.MetricsConfig;
import com.social.automation.integration.UrgentApprovalNotifier;
import com.social.automation.model.ApprovalEntry;
import com.social.automation.model.ApprovalStatus;
import com.social.automation.model.LearningEvent;
import com.social.automation.repository.ApprovalRepository;
import com.social.automation.repository.LearningEventRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable priority queue of actions waiting for human sign-off.
 * <p>
 * Entries move {@code PENDING -> APPROVED | AUTO_APPROVED | REJECTED} exactly once; every
 * transition is a conditional update on the stored entry, so an operator approval racing the
 * expiry sweep resolves to a single winner.
 */
@Service
public class ApprovalQueueService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalQueueService.class);

    static final String SYSTEM_ACTOR = "SYSTEM";

    /** Urgent first, then oldest first within a priority tier. */
    static final Comparator<ApprovalEntry> QUEUE_ORDER =
            Comparator.comparingInt(ApprovalEntry::getPriority).reversed()
                    .thenComparingLong(ApprovalEntry::getCreatedAt)
                    .thenComparing(ApprovalEntry::getApprovalId);

    private final ApprovalRepository approvalRepo;
    private final LearningEventRepository learningRepo;
    private final List<UrgentApprovalNotifier> notifiers;
    private final ApplicationEventPublisher eventPublisher;
    private final ApprovalConfig approvalConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ApprovalQueueService(ApprovalRepository approvalRepo,
                                LearningEventRepository learningRepo,
                                List<UrgentApprovalNotifier> notifiers,
                                ApplicationEventPublisher eventPublisher,
                                ApprovalConfig approvalConfig,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.approvalRepo = approvalRepo;
        this.learningRepo = learningRepo;
        this.notifiers = notifiers;
        this.eventPublisher = eventPublisher;
        this.approvalConfig = approvalConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Enqueue a proposed action.
     *
     * @param proposal         scope, item, rule, payload and priority of the proposal
     * @param autoApproveAfter epoch millis deadline; null applies the configured timeout, 0 disables
     */
    @Observed(name = "approval.enqueue", contextualName = "approval-enqueue")
    public ApprovalEntry addToQueue(ApprovalEntry proposal, Long autoApproveAfter) {
        long now = clock.millis();
        long deadline;
        if (autoApproveAfter != null) {
            deadline = autoApproveAfter;
        } else if (approvalConfig.getAutoApproveAfterMinutes() > 0) {
            deadline = now + approvalConfig.getAutoApproveAfterMinutes() * 60_000L;
        } else {
            deadline = 0;
        }

        ApprovalEntry entry = ApprovalEntry.builder()
                .approvalId(proposal.getApprovalId() != null ? proposal.getApprovalId() : UUID.randomUUID().toString())
                .scopeId(proposal.getScopeId())
                .itemId(proposal.getItemId())
                .responseId(proposal.getResponseId())
                .ruleId(proposal.getRuleId())
                .variantKey(proposal.getVariantKey())
                .payload(proposal.getPayload())
                .priority(proposal.getPriority())
                .status(ApprovalStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .autoApproveAfter(deadline)
                .urgent(proposal.getPriority() >= approvalConfig.getUrgentPriorityThreshold())
                .build();

        approvalRepo.save(entry);
        metricsConfig.recordApprovalEnqueued(entry.isUrgent());
        log.info("Queued approval {} for item {} (scope={}, priority={}, urgent={})",
                entry.getApprovalId(), entry.getItemId(), entry.getScopeId(), entry.getPriority(), entry.isUrgent());

        if (entry.isUrgent()) {
            notifyUrgent(List.of(entry));
        }
        return entry;
    }

    public List<ApprovalEntry> getPendingApprovals(String scopeId, int limit) {
        return approvalRepo.findPending(scopeId).stream()
                .sorted(QUEUE_ORDER)
                .limit(Math.max(0, limit))
                .toList();
    }

    public ApprovalEntry getApproval(String approvalId) {
        return approvalRepo.findById(approvalId);
    }

    /**
     * Approve every listed entry that is still pending.
     * @return number of entries this call moved to {@code APPROVED}
     */
    public int bulkApprove(List<String> approvalIds, String approvedBy, String reason) {
        int updated = transitionAll(approvalIds, ApprovalStatus.APPROVED, approvedBy, reason, "approval");
        log.info("Bulk approval: {} of {} entries approved by {}", updated, approvalIds.size(), approvedBy);
        return updated;
    }

    public int reject(List<String> approvalIds, String rejectedBy, String reason) {
        int updated = transitionAll(approvalIds, ApprovalStatus.REJECTED, rejectedBy, reason, "rejection");
        log.info("Rejection: {} of {} entries rejected by {}", updated, approvalIds.size(), rejectedBy);
        return updated;
    }

    /**
     * Auto-approve pending entries whose deadline has passed. Safe to call repeatedly: entries
     * already out of {@code PENDING} are not selected again.
     */
    @Observed(name = "approval.auto_approve", contextualName = "approval-auto-approve")
    public int autoApproveExpired() {
        long now = clock.millis();
        List<String> expired = approvalRepo.findPending(null).stream()
                .filter(e -> e.getAutoApproveAfter() > 0 && e.getAutoApproveAfter() <= now)
                .sorted(QUEUE_ORDER)
                .map(ApprovalEntry::getApprovalId)
                .toList();
        if (expired.isEmpty()) {
            return 0;
        }

        int updated = transitionAll(expired, ApprovalStatus.AUTO_APPROVED, SYSTEM_ACTOR,
                "auto-approved after timeout", "auto_approval");
        if (updated > 0) {
            log.info("Auto-approved {} expired approval entries", updated);
        }
        return updated;
    }

    public Map<String, Integer> getQueueStats() {
        ApprovalRepository.ApprovalCounts counts = approvalRepo.countByStatus();
        metricsConfig.updateUrgentPendingCount(counts.urgentPending());

        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("pending", counts.byStatus().getOrDefault(ApprovalStatus.PENDING, 0));
        stats.put("approved", counts.byStatus().getOrDefault(ApprovalStatus.APPROVED, 0));
        stats.put("autoApproved", counts.byStatus().getOrDefault(ApprovalStatus.AUTO_APPROVED, 0));
        stats.put("rejected", counts.byStatus().getOrDefault(ApprovalStatus.REJECTED, 0));
        stats.put("urgentPending", counts.urgentPending());
        return stats;
    }

    private int transitionAll(List<String> approvalIds, ApprovalStatus target,
                              String actor, String reason, String eventType) {
        int updated = 0;
        for (String approvalId : new LinkedHashSet<>(approvalIds)) {
            if (!approvalRepo.transitionFromPending(approvalId, target, actor, reason, clock.millis())) {
                continue;
            }
            updated++;
            ApprovalEntry entry = approvalRepo.findById(approvalId);
            if (entry == null) {
                continue;
            }
            recordLearningEvent(entry, eventType, actor, reason);
            if (target != ApprovalStatus.REJECTED) {
                eventPublisher.publishEvent(new ApprovalGrantedEvent(entry));
            }
        }
        if (updated > 0) {
            metricsConfig.recordApprovalTransition(target.name(), updated);
        }
        return updated;
    }

    private void recordLearningEvent(ApprovalEntry entry, String eventType, String actor, String reason) {
        try {
            learningRepo.save(LearningEvent.builder()
                    .eventType(eventType)
                    .approvalId(entry.getApprovalId())
                    .scopeId(entry.getScopeId())
                    .ruleId(entry.getRuleId())
                    .variantKey(entry.getVariantKey())
                    .priority(entry.getPriority())
                    .actor(actor)
                    .reason(reason)
                    .createdAt(clock.millis())
                    .build());
        } catch (Exception e) {
            log.warn("Failed to record {} learning event for approval {}: {}",
                    eventType, entry.getApprovalId(), e.getMessage());
        }
    }

    private void notifyUrgent(List<ApprovalEntry> entries) {
        for (UrgentApprovalNotifier notifier : notifiers) {
            try {
                notifier.notifyUrgent(entries);
            } catch (Exception e) {
                log.error("Urgent approval notifier {} failed: {}",
                        notifier.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
