package com.social.automation.controller;

import com.social.automation.service.OutcomeFeedbackService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/outcomes")
@Tag(name = "Outcomes", description = "Downstream feedback signals for responses")
public class OutcomeController {

    private final OutcomeFeedbackService feedbackService;

    public OutcomeController(OutcomeFeedbackService feedbackService) {
        this.feedbackService = feedbackService;
    }

    public record OutcomeRequest(String ruleId, String variantKey, long impressions, long conversions,
                                 Double engagement, Boolean automated) {}

    @PostMapping
    @Operation(summary = "Record outcome feedback",
               description = "Impressions, conversions and an optional engagement score for a rule's response. "
                       + "variantKey uses the testId::variantId form.")
    public ResponseEntity<?> recordOutcome(@RequestBody OutcomeRequest request) {
        try {
            feedbackService.recordFeedback(request.ruleId(), request.variantKey(), request.impressions(),
                    request.conversions(), request.engagement(),
                    request.automated() == null || request.automated());
            return ResponseEntity.accepted().body(Map.of("status", "recorded"));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
