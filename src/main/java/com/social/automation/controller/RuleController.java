package com.social.automation.controller;

import com.social.automation.model.AutomationRule;
import com.social.automation.model.action.RuleDefinitionException;
import com.social.automation.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Manage automation rules (CRUD + enable/disable)")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Operation(summary = "List all automation rules",
            description = "Returns every stored rule, grouped by scope and in evaluation order.")
    @GetMapping
    public ResponseEntity<List<AutomationRule>> listRules() {
        return ResponseEntity.ok(ruleService.getAllRules());
    }

    @Operation(summary = "Get a specific rule by ID")
    @GetMapping("/{ruleId}")
    public ResponseEntity<AutomationRule> getRule(
            @Parameter(description = "Rule ID", example = "RULE-REFUND-FLAG")
            @PathVariable String ruleId) {
        AutomationRule rule = ruleService.getRule(ruleId);
        if (rule == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(rule);
    }

    @Operation(summary = "Create a new automation rule",
            description = "Validates and stores a rule. Invalid actions or variant weights are rejected with 400.")
    @PostMapping
    public ResponseEntity<?> createRule(@RequestBody AutomationRule rule) {
        try {
            return ResponseEntity.ok(ruleService.createRule(rule));
        } catch (RuleDefinitionException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Update an existing rule",
            description = "Change conditions, action, limits, A/B tests, or enable/disable the rule.")
    @PutMapping("/{ruleId}")
    public ResponseEntity<?> updateRule(
            @Parameter(description = "Rule ID", example = "RULE-REFUND-FLAG")
            @PathVariable String ruleId,
            @RequestBody AutomationRule updated) {
        try {
            AutomationRule result = ruleService.updateRule(ruleId, updated);
            if (result == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(result);
        } catch (RuleDefinitionException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Delete a rule")
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(@PathVariable String ruleId) {
        if (!ruleService.deleteRule(ruleId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }
}
