package com.social.automation.service;

import com.social.automation.model.VariantKey;
import com.social.automation.repository.DailyOutcomeRepository;
import com.social.automation.repository.OutcomeMetricRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutcomeFeedbackServiceTest {

    @Mock private OutcomeMetricRepository outcomeRepo;
    @Mock private DailyOutcomeRepository dailyOutcomeRepo;

    private OutcomeFeedbackService service;

    @BeforeEach
    void setUp() {
        // 23:30 UTC, the daily bucket must still be the 10th
        service = new OutcomeFeedbackService(outcomeRepo, dailyOutcomeRepo,
                Clock.fixed(Instant.parse("2026-03-10T23:30:00Z"), ZoneOffset.ofHours(5)));
    }

    @Test
    void automatedFeedback_updatesVariantAndDailyCounters() {
        service.recordFeedback("R-1", "t1::B", 100, 12, 4.5, true);

        verify(outcomeRepo).recordFeedback("R-1", new VariantKey("t1", "B"), 100, 12, 4.5);
        verify(dailyOutcomeRepo).recordFeedback("R-1", LocalDate.of(2026, 3, 10), true, 100, 12, 4.5);
    }

    @Test
    void manualFeedback_onlyUpdatesDailyBucket() {
        service.recordFeedback("R-1", "t1::B", 10, 1, null, false);

        verifyNoInteractions(outcomeRepo);
        verify(dailyOutcomeRepo).recordFeedback("R-1", LocalDate.of(2026, 3, 10), false, 10, 1, null);
    }

    @Test
    void automatedFeedbackWithoutVariant_skipsVariantCounters() {
        service.recordFeedback("R-1", null, 10, 1, null, true);

        verifyNoInteractions(outcomeRepo);
        verify(dailyOutcomeRepo).recordFeedback(eq("R-1"), any(), eq(true), eq(10L), eq(1L), isNull());
    }

    @Test
    void conversionOnlyFeedback_isAcceptedForDispatchedVariant() {
        service.recordFeedback("R-1", "t1::A", 0, 1, null, true);

        verify(outcomeRepo).recordFeedback("R-1", new VariantKey("t1", "A"), 0, 1, null);
        verify(dailyOutcomeRepo).recordFeedback("R-1", LocalDate.of(2026, 3, 10), true, 0, 1, null);
    }

    @Test
    void invalidFeedback_isRejected() {
        assertThatThrownBy(() -> service.recordFeedback(" ", null, 1, 0, null, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recordFeedback("R-1", null, -1, 0, null, true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.recordFeedback("R-1", null, 0, -2, null, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
        verifyNoInteractions(outcomeRepo, dailyOutcomeRepo);
    }
}
