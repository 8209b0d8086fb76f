package com.social.automation.controller;

import com.social.automation.engine.abtest.TestAnalysis;
import com.social.automation.model.PagedResponse;
import com.social.automation.model.VariantWeightChange;
import com.social.automation.repository.VariantWeightHistoryRepository;
import com.social.automation.service.OptimizationResult;
import com.social.automation.service.VariantOptimizationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/abtests")
@Tag(name = "A/B Tests", description = "Significance testing and automatic reweighting of rule variants")
public class AbTestController {

    private final VariantOptimizationService optimizationService;
    private final VariantWeightHistoryRepository weightHistoryRepo;

    public AbTestController(VariantOptimizationService optimizationService,
                            VariantWeightHistoryRepository weightHistoryRepo) {
        this.optimizationService = optimizationService;
        this.weightHistoryRepo = weightHistoryRepo;
    }

    @GetMapping("/{ruleId}/winner")
    @Operation(summary = "Calculate per-test winners",
               description = "Two-tailed test of the best variant against the runner-up for every embedded test")
    public ResponseEntity<Map<String, TestAnalysis>> getWinner(
            @Parameter(description = "Rule ID", example = "RULE-THANKS")
            @PathVariable String ruleId,
            @RequestParam(required = false) Integer minSamples) {
        return ResponseEntity.ok(optimizationService.analyze(ruleId, minSamples));
    }

    @PostMapping("/{ruleId}/optimize")
    @Operation(summary = "Reweight variants now",
               description = "Applies significant winners to the rule's variant weights")
    public ResponseEntity<OptimizationResult> optimize(@PathVariable String ruleId) {
        OptimizationResult result = optimizationService.autoOptimize(ruleId);
        if ("rule_not_found".equals(result.reason())) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{ruleId}/history")
    @Operation(summary = "Get variant weight history",
               description = "Automatic reweights and pauses for the rule, newest first. Paginate with before.")
    public ResponseEntity<PagedResponse<VariantWeightChange>> getHistory(
            @PathVariable String ruleId,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(weightHistoryRepo.findByRuleId(ruleId, limit, before));
    }
}
