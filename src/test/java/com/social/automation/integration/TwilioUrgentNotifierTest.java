package com.social.automation.integration;

import com.social.automation.config.MetricsConfig;
import com.social.automation.config.TwilioNotificationConfig;
import com.social.automation.model.ApprovalEntry;
import com.social.automation.model.ApprovalStatus;
import com.social.automation.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class TwilioUrgentNotifierTest {

    @Mock private MetricsConfig metricsConfig;

    private TwilioUrgentNotifier notifier(int maxEntries) {
        TwilioNotificationConfig config = new TwilioNotificationConfig();
        config.setMaxEntriesPerMessage(maxEntries);
        return new TwilioUrgentNotifier(config, metricsConfig);
    }

    @Test
    void buildMessageBody_listsEntries() {
        ApprovalEntry entry = TestDataFactory.createApproval("A1", 9, 1_000L, ApprovalStatus.PENDING);

        String body = notifier(5).buildMessageBody(List.of(entry));

        assertThat(body).isEqualTo("[APPROVAL] 1 urgent item(s) waiting\nScope CH-001, item item-A1, priority 9");
    }

    @Test
    void buildMessageBody_truncatesLongBatches() {
        List<ApprovalEntry> entries = IntStream.range(0, 4)
                .mapToObj(i -> TestDataFactory.createApproval("A" + i, 9, 1_000L, ApprovalStatus.PENDING))
                .toList();

        String body = notifier(2).buildMessageBody(entries);

        assertThat(body).startsWith("[APPROVAL] 4 urgent item(s) waiting");
        assertThat(body.lines().filter(l -> l.startsWith("Scope "))).hasSize(2);
        assertThat(body).endsWith("\n...");
    }

    @Test
    void notifyUrgent_emptyBatchSendsNothing() {
        notifier(5).notifyUrgent(List.of());

        verifyNoInteractions(metricsConfig);
    }
}
