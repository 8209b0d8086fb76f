package com.social.automation.controller;

import com.social.automation.model.ApprovalEntry;
import com.social.automation.service.ApprovalQueueService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/approvals")
@Tag(name = "Approvals", description = "Human approval queue for proposed automated actions")
public class ApprovalController {

    private final ApprovalQueueService approvalQueueService;

    public ApprovalController(ApprovalQueueService approvalQueueService) {
        this.approvalQueueService = approvalQueueService;
    }

    @GetMapping
    @Operation(summary = "List pending approvals",
               description = "Pending entries ordered by priority (highest first), then age (oldest first)")
    public ResponseEntity<List<ApprovalEntry>> getPending(
            @Parameter(description = "Scope ID", example = "CH-001")
            @RequestParam(required = false) String scopeId,
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(approvalQueueService.getPendingApprovals(scopeId, limit));
    }

    @GetMapping("/{approvalId}")
    @Operation(summary = "Get an approval entry")
    public ResponseEntity<ApprovalEntry> getApproval(@PathVariable String approvalId) {
        ApprovalEntry entry = approvalQueueService.getApproval(approvalId);
        if (entry == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(entry);
    }

    @PostMapping("/bulk-approve")
    @Operation(summary = "Approve pending entries",
               description = "Moves every listed pending entry to APPROVED. Entries no longer pending are skipped.")
    public ResponseEntity<?> bulkApprove(@RequestBody Map<String, Object> body) {
        return transition(body, "approvedBy", true);
    }

    @PostMapping("/reject")
    @Operation(summary = "Reject pending entries",
               description = "Moves every listed pending entry to REJECTED. Entries no longer pending are skipped.")
    public ResponseEntity<?> reject(@RequestBody Map<String, Object> body) {
        return transition(body, "rejectedBy", false);
    }

    @GetMapping("/stats")
    @Operation(summary = "Get approval queue statistics",
               description = "Returns counts by status plus the number of urgent pending entries")
    public ResponseEntity<Map<String, Integer>> getStats() {
        return ResponseEntity.ok(approvalQueueService.getQueueStats());
    }

    private ResponseEntity<?> transition(Map<String, Object> body, String actorField, boolean approve) {
        Object rawIds = body.get("ids");
        if (!(rawIds instanceof List<?> list) || list.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "ids is required and must not be empty"));
        }
        List<String> ids = list.stream().map(String::valueOf).toList();
        String actor = String.valueOf(body.getOrDefault(actorField, "ops"));
        String reason = body.get("reason") != null ? String.valueOf(body.get("reason")) : null;

        int updatedCount = approve
                ? approvalQueueService.bulkApprove(ids, actor, reason)
                : approvalQueueService.reject(ids, actor, reason);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("updatedCount", updatedCount);
        response.put("requestedCount", ids.size());
        return ResponseEntity.ok(response);
    }
}
