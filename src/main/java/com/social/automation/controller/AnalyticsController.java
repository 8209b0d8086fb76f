package com.social.automation.controller;

import com.social.automation.model.analytics.AutomationComparison;
import com.social.automation.model.analytics.BestWorstReport;
import com.social.automation.model.analytics.CtrAnomaly;
import com.social.automation.model.analytics.RoiReport;
import com.social.automation.model.analytics.RuleSuggestion;
import com.social.automation.model.analytics.WeeklyReport;
import com.social.automation.service.AnalyticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Analytics", description = "Rule performance, CTR anomalies and ROI")
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/rules/best-worst")
    @Operation(summary = "Best and worst rules",
               description = "Ranks rules by CTR, then mean engagement, over a rolling window")
    public ResponseEntity<BestWorstReport> getBestWorst(
            @RequestParam(required = false) Integer windowDays,
            @RequestParam(required = false) Integer topN) {
        return ResponseEntity.ok(analyticsService.getBestWorstRules(windowDays, topN));
    }

    @GetMapping("/anomalies")
    @Operation(summary = "CTR anomalies",
               description = "Days whose CTR deviates from the trailing 7-day mean by at least the configured fraction")
    public ResponseEntity<List<CtrAnomaly>> getAnomalies(
            @RequestParam(required = false) String ruleId,
            @RequestParam(required = false) Integer lookbackDays) {
        return ResponseEntity.ok(analyticsService.detectCtrAnomalies(ruleId, lookbackDays));
    }

    @GetMapping("/rules/{ruleId}/roi")
    @Operation(summary = "Rule ROI", description = "Labor value of automated responses minus their cost")
    public ResponseEntity<RoiReport> getRoi(
            @Parameter(description = "Rule ID", example = "RULE-THANKS")
            @PathVariable String ruleId,
            @RequestParam(required = false) Integer windowDays) {
        return ResponseEntity.ok(analyticsService.calculateRoi(ruleId, windowDays));
    }

    @GetMapping("/rules/{ruleId}/automated-vs-manual")
    @Operation(summary = "Automated vs manual responses")
    public ResponseEntity<AutomationComparison> getComparison(
            @PathVariable String ruleId,
            @RequestParam(required = false) Integer windowDays) {
        return ResponseEntity.ok(analyticsService.compareAutomatedVsManual(ruleId, windowDays));
    }

    @GetMapping("/weekly-report")
    @Operation(summary = "Weekly report", description = "Per ISO week rule aggregates, most recent week first")
    public ResponseEntity<List<WeeklyReport>> getWeeklyReport(@RequestParam(defaultValue = "4") int weeks) {
        return ResponseEntity.ok(analyticsService.getWeeklyReports(weeks));
    }

    @GetMapping("/suggestions")
    @Operation(summary = "Optimization suggestions",
               description = "A/B reweight, pause and follow-up suggestions plus CTR drops worth investigating")
    public ResponseEntity<List<RuleSuggestion>> getSuggestions() {
        return ResponseEntity.ok(analyticsService.getSuggestions());
    }
}
