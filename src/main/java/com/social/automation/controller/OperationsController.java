package com.social.automation.controller;

import com.social.automation.engine.ScopeRunResult;
import com.social.automation.scheduler.AutomationCycle;
import com.social.automation.service.ApprovalQueueService;
import com.social.automation.service.PollingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/operations")
@Tag(name = "Operations", description = "Run one polling, automation or approval-sweep tick on demand")
public class OperationsController {

    private final PollingService pollingService;
    private final AutomationCycle automationCycle;
    private final ApprovalQueueService approvalQueueService;

    public OperationsController(PollingService pollingService,
                                AutomationCycle automationCycle,
                                ApprovalQueueService approvalQueueService) {
        this.pollingService = pollingService;
        this.automationCycle = automationCycle;
        this.approvalQueueService = approvalQueueService;
    }

    @PostMapping("/poll")
    @Operation(summary = "Poll due scopes now", description = "Returns the number of newly enqueued items")
    public ResponseEntity<Map<String, Integer>> poll(@RequestParam(required = false) String scopeId) {
        try {
            int enqueued = scopeId != null ? pollingService.pollScope(scopeId) : pollingService.pollDueScopes();
            return ResponseEntity.ok(Map.of("enqueued", enqueued));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping("/automation")
    @Operation(summary = "Run one automation cycle",
               description = "Evaluates every scope with enabled rules that is not already being processed")
    public ResponseEntity<List<ScopeRunResult>> runAutomation() {
        return ResponseEntity.ok(automationCycle.runOnce());
    }

    @PostMapping("/approval-sweep")
    @Operation(summary = "Auto-approve expired entries")
    public ResponseEntity<Map<String, Integer>> approvalSweep() {
        return ResponseEntity.ok(Map.of("autoApproved", approvalQueueService.autoApproveExpired()));
    }
}
