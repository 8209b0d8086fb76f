package com.social.automation.service;

import com.social.automation.model.VariantKey;
import com.social.automation.repository.DailyOutcomeRepository;
import com.social.automation.repository.OutcomeMetricRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Records downstream outcome signals (impressions, conversions, engagement) for responses.
 * Variant counters only see automated responses; daily buckets see both automated and manual.
 */
@Service
public class OutcomeFeedbackService {

    private static final Logger log = LoggerFactory.getLogger(OutcomeFeedbackService.class);

    private final OutcomeMetricRepository outcomeRepo;
    private final DailyOutcomeRepository dailyOutcomeRepo;
    private final Clock clock;

    public OutcomeFeedbackService(OutcomeMetricRepository outcomeRepo,
                                  DailyOutcomeRepository dailyOutcomeRepo,
                                  Clock clock) {
        this.outcomeRepo = outcomeRepo;
        this.dailyOutcomeRepo = dailyOutcomeRepo;
        this.clock = clock;
    }

    /**
     * Impressions for automated responses are already counted at dispatch, so a later click
     * or conversion arrives as {@code impressions=0, conversions>0}.
     */
    public void recordFeedback(String ruleId, String variantKey, long impressions, long conversions,
                               Double engagement, boolean automated) {
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException("ruleId is required");
        }
        if (impressions < 0 || conversions < 0) {
            throw new IllegalArgumentException("impressions and conversions must not be negative");
        }

        if (automated && variantKey != null && !variantKey.isBlank()) {
            outcomeRepo.recordFeedback(ruleId, VariantKey.parse(variantKey), impressions, conversions, engagement);
        }
        dailyOutcomeRepo.recordFeedback(ruleId, LocalDate.now(clock.withZone(ZoneOffset.UTC)), automated,
                impressions, conversions, engagement);
        log.debug("Outcome feedback for rule {} ({}): impressions={}, conversions={}, engagement={}",
                ruleId, automated ? "automated" : "manual", impressions, conversions, engagement);
    }
}
