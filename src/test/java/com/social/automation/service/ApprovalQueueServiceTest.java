package com.social.automation.service;

import com.social.automation.config.ApprovalConfig;
import com.social.automation.config.MetricsConfig;
import com.social.automation.integration.UrgentApprovalNotifier;
import com.social.automation.model.ApprovalEntry;
import com.social.automation.model.ApprovalStatus;
import com.social.automation.model.LearningEvent;
import com.social.automation.repository.ApprovalRepository;
import com.social.automation.repository.LearningEventRepository;
import com.social.automation.testutil.MutableClock;
import com.social.automation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ApprovalQueueServiceTest {

    @Mock private ApprovalRepository approvalRepo;
    @Mock private LearningEventRepository learningRepo;
    @Mock private UrgentApprovalNotifier notifier;
    @Mock private ApplicationEventPublisher eventPublisher;
    @Mock private MetricsConfig metricsConfig;

    private MutableClock clock;
    private ApprovalQueueService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"));
        ApprovalConfig config = new ApprovalConfig();
        config.setUrgentPriorityThreshold(90);
        config.setAutoApproveAfterMinutes(60);
        service = new ApprovalQueueService(approvalRepo, learningRepo, List.of(notifier),
                eventPublisher, config, metricsConfig, clock);
    }

    private ApprovalEntry proposal(int priority) {
        return ApprovalEntry.builder()
                .scopeId(TestDataFactory.SCOPE)
                .itemId("i1")
                .ruleId("RULE-1")
                .payload(Map.of("responseText", "Thanks!"))
                .priority(priority)
                .build();
    }

    @Test
    void addToQueue_highPriority_isUrgentAndNotifies() {
        ApprovalEntry entry = service.addToQueue(proposal(95), null);

        assertThat(entry.isUrgent()).isTrue();
        assertThat(entry.getStatus()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(entry.getAutoApproveAfter()).isEqualTo(clock.millis() + 60 * 60_000L);
        verify(approvalRepo).save(entry);
        verify(notifier).notifyUrgent(List.of(entry));
        verify(metricsConfig).recordApprovalEnqueued(true);
    }

    @Test
    void addToQueue_lowPriority_doesNotNotify() {
        ApprovalEntry entry = service.addToQueue(proposal(10), 0L);

        assertThat(entry.isUrgent()).isFalse();
        assertThat(entry.getAutoApproveAfter()).isZero();
        verifyNoInteractions(notifier);
    }

    @Test
    void addToQueue_failingNotifier_doesNotFailEnqueue() {
        doThrow(new IllegalStateException("sms down")).when(notifier).notifyUrgent(anyList());

        ApprovalEntry entry = service.addToQueue(proposal(99), null);

        assertThat(entry.getApprovalId()).isNotBlank();
        verify(approvalRepo).save(entry);
    }

    @Test
    void getPendingApprovals_priorityDescThenOldestFirst() {
        when(approvalRepo.findPending(null)).thenReturn(List.of(
                TestDataFactory.createApproval("low-old", 10, 1_000L, ApprovalStatus.PENDING),
                TestDataFactory.createApproval("high-new", 95, 5_000L, ApprovalStatus.PENDING),
                TestDataFactory.createApproval("high-old", 95, 2_000L, ApprovalStatus.PENDING),
                TestDataFactory.createApproval("low-new", 10, 9_000L, ApprovalStatus.PENDING)));

        List<ApprovalEntry> pending = service.getPendingApprovals(null, 10);

        assertThat(pending).extracting(ApprovalEntry::getApprovalId)
                .containsExactly("high-old", "high-new", "low-old", "low-new");
    }

    @Test
    void bulkApprove_countsOnlyEntriesThatWereStillPending() {
        ApprovalEntry a1 = TestDataFactory.createApproval("A1", 50, 1L, ApprovalStatus.APPROVED);
        when(approvalRepo.transitionFromPending(eq("A1"), eq(ApprovalStatus.APPROVED), eq("ops-1"), eq("ok"), anyLong()))
                .thenReturn(true);
        when(approvalRepo.transitionFromPending(eq("A2"), eq(ApprovalStatus.APPROVED), eq("ops-1"), eq("ok"), anyLong()))
                .thenReturn(false);
        when(approvalRepo.findById("A1")).thenReturn(a1);

        int updated = service.bulkApprove(List.of("A1", "A2", "A1"), "ops-1", "ok");

        assertThat(updated).isEqualTo(1);
        ArgumentCaptor<LearningEvent> event = ArgumentCaptor.forClass(LearningEvent.class);
        verify(learningRepo).save(event.capture());
        assertThat(event.getValue().getEventType()).isEqualTo("approval");
        assertThat(event.getValue().getActor()).isEqualTo("ops-1");
        verify(eventPublisher).publishEvent(new ApprovalGrantedEvent(a1));
        verify(metricsConfig).recordApprovalTransition("APPROVED", 1);
    }

    @Test
    void bulkApprove_learningEventFailure_doesNotFailApproval() {
        when(approvalRepo.transitionFromPending(eq("A1"), eq(ApprovalStatus.APPROVED), any(), any(), anyLong()))
                .thenReturn(true);
        when(approvalRepo.findById("A1"))
                .thenReturn(TestDataFactory.createApproval("A1", 50, 1L, ApprovalStatus.APPROVED));
        doThrow(new RuntimeException("store unavailable")).when(learningRepo).save(any());

        assertThat(service.bulkApprove(List.of("A1"), "ops-1", null)).isEqualTo(1);
    }

    @Test
    void reject_doesNotPublishGrantEvent() {
        when(approvalRepo.transitionFromPending(eq("A1"), eq(ApprovalStatus.REJECTED), eq("ops-1"), eq("off-brand"), anyLong()))
                .thenReturn(true);
        when(approvalRepo.findById("A1"))
                .thenReturn(TestDataFactory.createApproval("A1", 50, 1L, ApprovalStatus.REJECTED));

        assertThat(service.reject(List.of("A1"), "ops-1", "off-brand")).isEqualTo(1);
        verify(learningRepo).save(argThat(e -> "rejection".equals(e.getEventType())));
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void autoApproveExpired_onlyPastDeadline_andIdempotent() {
        ApprovalEntry expired = TestDataFactory.createApproval("E1", 50, 1L, ApprovalStatus.PENDING);
        expired.setAutoApproveAfter(clock.millis() - 1);
        ApprovalEntry future = TestDataFactory.createApproval("F1", 50, 1L, ApprovalStatus.PENDING);
        future.setAutoApproveAfter(clock.millis() + Duration.ofMinutes(30).toMillis());
        ApprovalEntry never = TestDataFactory.createApproval("N1", 50, 1L, ApprovalStatus.PENDING);

        when(approvalRepo.findPending(null))
                .thenReturn(List.of(expired, future, never))
                .thenReturn(List.of(future, never));
        when(approvalRepo.transitionFromPending(eq("E1"), eq(ApprovalStatus.AUTO_APPROVED), eq("SYSTEM"),
                eq("auto-approved after timeout"), anyLong())).thenReturn(true);
        ApprovalEntry approved = TestDataFactory.createApproval("E1", 50, 1L, ApprovalStatus.AUTO_APPROVED);
        when(approvalRepo.findById("E1")).thenReturn(approved);

        assertThat(service.autoApproveExpired()).isEqualTo(1);
        assertThat(service.autoApproveExpired()).isZero();

        verify(approvalRepo, times(1)).transitionFromPending(any(), any(), any(), any(), anyLong());
        verify(learningRepo).save(argThat(e -> "auto_approval".equals(e.getEventType())));
        verify(eventPublisher).publishEvent(new ApprovalGrantedEvent(approved));
    }

    @Test
    void autoApproveExpired_lostRaceToOperator_countsNothing() {
        ApprovalEntry expired = TestDataFactory.createApproval("E1", 50, 1L, ApprovalStatus.PENDING);
        expired.setAutoApproveAfter(clock.millis() - 1);
        when(approvalRepo.findPending(null)).thenReturn(List.of(expired));
        when(approvalRepo.transitionFromPending(eq("E1"), any(), any(), any(), anyLong())).thenReturn(false);

        assertThat(service.autoApproveExpired()).isZero();
        verifyNoInteractions(learningRepo, eventPublisher);
    }

    @Test
    void getQueueStats_mapsCountsAndUpdatesGauge() {
        when(approvalRepo.countByStatus()).thenReturn(new ApprovalRepository.ApprovalCounts(
                Map.of(ApprovalStatus.PENDING, 4, ApprovalStatus.APPROVED, 3,
                        ApprovalStatus.AUTO_APPROVED, 2, ApprovalStatus.REJECTED, 1), 2));

        Map<String, Integer> stats = service.getQueueStats();

        assertThat(stats).containsEntry("pending", 4)
                .containsEntry("approved", 3)
                .containsEntry("autoApproved", 2)
                .containsEntry("rejected", 1)
                .containsEntry("urgentPending", 2);
        verify(metricsConfig).updateUrgentPendingCount(2);
    }
}
