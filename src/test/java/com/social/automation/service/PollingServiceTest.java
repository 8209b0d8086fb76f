package com.social.automation.service;

import com.social.automation.config.AutomationConfig;
import com.social.automation.config.MetricsConfig;
import com.social.automation.integration.Classification;
import com.social.automation.integration.Classifier;
import com.social.automation.integration.ContentRef;
import com.social.automation.integration.RawItem;
import com.social.automation.integration.SourceConnector;
import com.social.automation.model.ItemStatus;
import com.social.automation.model.QueuedItem;
import com.social.automation.model.ScopeState;
import com.social.automation.repository.QueuedItemRepository;
import com.social.automation.repository.ScopeRepository;
import com.social.automation.testutil.MutableClock;
import com.social.automation.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PollingServiceTest {

    @Mock private ObjectProvider<SourceConnector> connectorProvider;
    @Mock private SourceConnector connector;
    @Mock private Classifier classifier;
    @Mock private QueuedItemRepository queuedItemRepo;
    @Mock private ScopeRepository scopeRepo;
    @Mock private MetricsConfig metricsConfig;

    private MutableClock clock;
    private PollingService service;

    private final ContentRef video = new ContentRef("VID-1", "Launch video", 1L);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-10T12:00:00Z"));
        AutomationConfig config = new AutomationConfig();
        config.getPolling().setDefaultPollIntervalMinutes(15);
        config.getPolling().setInitialLookbackHours(48);
        service = new PollingService(connectorProvider, classifier, queuedItemRepo, scopeRepo,
                config, metricsConfig, clock);
    }

    @Test
    void shouldPoll_neverPolled_isDue() {
        assertThat(service.shouldPoll(TestDataFactory.createScope("CH-001", 0, 0L), clock.millis())).isTrue();
    }

    @Test
    void shouldPoll_respectsScopeIntervalThenDefault() {
        long now = clock.millis();
        ScopeState custom = TestDataFactory.createScope("CH-001", 5, now - Duration.ofMinutes(4).toMillis());
        ScopeState defaulted = TestDataFactory.createScope("CH-002", 0, now - Duration.ofMinutes(16).toMillis());

        assertThat(service.shouldPoll(custom, now)).isFalse();
        assertThat(service.shouldPoll(custom, now + Duration.ofMinutes(1).toMillis())).isTrue();
        assertThat(service.shouldPoll(defaulted, now)).isTrue();
    }

    @Test
    void pollScope_firstPoll_usesLookbackAndQueuesClassifiedItems() {
        when(scopeRepo.findById("CH-001")).thenReturn(TestDataFactory.createScope("CH-001", 0, 0L));
        when(connectorProvider.getIfAvailable()).thenReturn(connector);
        long expectedSince = clock.millis() - Duration.ofHours(48).toMillis();
        when(connector.listNewParentContent("CH-001", expectedSince)).thenReturn(List.of(video));
        when(connector.listNewChildItems("CH-001", video)).thenReturn(List.of(
                new RawItem("c1", "How do I get a refund?", "u1", "subscriber", 100L)));
        when(classifier.classify("How do I get a refund?"))
                .thenReturn(new Classification("question", List.of("refund"), "en"));
        when(queuedItemRepo.insertIfAbsent(any())).thenReturn(true);

        int enqueued = service.pollScope("CH-001");

        assertThat(enqueued).isEqualTo(1);
        ArgumentCaptor<QueuedItem> captor = ArgumentCaptor.forClass(QueuedItem.class);
        verify(queuedItemRepo).insertIfAbsent(captor.capture());
        QueuedItem item = captor.getValue();
        assertThat(item.getItemId()).isEqualTo("c1");
        assertThat(item.getContentId()).isEqualTo("VID-1");
        assertThat(item.getClassification()).isEqualTo("question");
        assertThat(item.getAuthorStatus()).isEqualTo("subscriber");
        assertThat(item.getStatus()).isEqualTo(ItemStatus.PENDING);
        verify(scopeRepo).updateLastPolledAt("CH-001", clock.millis());
        verify(metricsConfig).recordItemsEnqueued(1);
    }

    @Test
    void pollScope_isIdempotentForAlreadyQueuedItems() {
        when(scopeRepo.findById("CH-001")).thenReturn(TestDataFactory.createScope("CH-001", 0, 0L));
        when(connectorProvider.getIfAvailable()).thenReturn(connector);
        when(connector.listNewParentContent(eq("CH-001"), anyLong())).thenReturn(List.of(video));
        when(connector.listNewChildItems("CH-001", video)).thenReturn(List.of(
                new RawItem("c1", "first", "u1", null, 100L),
                new RawItem("c2", "second", "u2", null, 200L)));
        when(queuedItemRepo.insertIfAbsent(any()))
                .thenReturn(true, true)
                .thenReturn(false, false);

        assertThat(service.pollScope("CH-001")).isEqualTo(2);
        assertThat(service.pollScope("CH-001")).isZero();
        verify(metricsConfig, times(1)).recordItemsEnqueued(2);
    }

    @Test
    void pollScope_failingContentIsSkipped() {
        ContentRef broken = new ContentRef("VID-2", "Broken", 2L);
        when(scopeRepo.findById("CH-001")).thenReturn(TestDataFactory.createScope("CH-001", 0, 0L));
        when(connectorProvider.getIfAvailable()).thenReturn(connector);
        when(connector.listNewParentContent(eq("CH-001"), anyLong())).thenReturn(List.of(broken, video));
        when(connector.listNewChildItems("CH-001", broken)).thenThrow(new RuntimeException("HTTP 503"));
        when(connector.listNewChildItems("CH-001", video)).thenReturn(List.of(new RawItem("c1", "hi", "u1", null, 1L)));
        when(queuedItemRepo.insertIfAbsent(any())).thenReturn(true);

        assertThat(service.pollScope("CH-001")).isEqualTo(1);
    }

    @Test
    void pollScope_classifierFailure_queuesUnlabelled() {
        when(scopeRepo.findById("CH-001")).thenReturn(TestDataFactory.createScope("CH-001", 0, 0L));
        when(connectorProvider.getIfAvailable()).thenReturn(connector);
        when(connector.listNewParentContent(eq("CH-001"), anyLong())).thenReturn(List.of(video));
        when(connector.listNewChildItems("CH-001", video)).thenReturn(List.of(new RawItem("c1", "hi", "u1", null, 1L)));
        when(classifier.classify("hi")).thenThrow(new RuntimeException("model offline"));
        when(queuedItemRepo.insertIfAbsent(any())).thenReturn(true);

        assertThat(service.pollScope("CH-001")).isEqualTo(1);
        verify(queuedItemRepo).insertIfAbsent(argThat(item -> item.getClassification() == null));
    }

    @Test
    void pollScope_withoutConnector_skips() {
        when(scopeRepo.findById("CH-001")).thenReturn(TestDataFactory.createScope("CH-001", 0, 0L));
        when(connectorProvider.getIfAvailable()).thenReturn(null);

        assertThat(service.pollScope("CH-001")).isZero();
        verify(scopeRepo, never()).updateLastPolledAt(any(), anyLong());
    }

    @Test
    void pollScope_unknownScope_throws() {
        assertThatThrownBy(() -> service.pollScope("NOPE"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NOPE");
    }

    @Test
    void pollDueScopes_failingScopeDoesNotStopOthers() {
        ScopeState bad = TestDataFactory.createScope("CH-BAD", 0, 0L);
        ScopeState good = TestDataFactory.createScope("CH-001", 0, 0L);
        when(scopeRepo.findPollingEnabled()).thenReturn(List.of(bad, good));
        when(connectorProvider.getIfAvailable()).thenReturn(connector);
        when(connector.listNewParentContent(eq("CH-BAD"), anyLong())).thenThrow(new RuntimeException("auth expired"));
        when(connector.listNewParentContent(eq("CH-001"), anyLong())).thenReturn(List.of(video));
        when(connector.listNewChildItems("CH-001", video)).thenReturn(List.of(new RawItem("c1", "hi", "u1", null, 1L)));
        when(queuedItemRepo.insertIfAbsent(any())).thenReturn(true);

        assertThat(service.pollDueScopes()).isEqualTo(1);
        verify(metricsConfig).recordScopeFailure("polling");
    }
}
