package com.social.automation.controller;

import com.social.automation.model.ExecutionRecord;
import com.social.automation.model.PagedResponse;
import com.social.automation.repository.ExecutionLogRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/executions")
@Tag(name = "Executions", description = "Audit log of executed, declined and failed actions")
public class ExecutionController {

    private final ExecutionLogRepository executionLogRepo;

    public ExecutionController(ExecutionLogRepository executionLogRepo) {
        this.executionLogRepo = executionLogRepo;
    }

    @GetMapping
    @Operation(summary = "Search the execution log",
               description = "Newest first. Filter by scope, rule or outcome; paginate with before.")
    public ResponseEntity<PagedResponse<ExecutionRecord>> search(
            @RequestParam(required = false) String scopeId,
            @RequestParam(required = false) String ruleId,
            @RequestParam(required = false) String outcome,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(executionLogRepo.findByFilters(scopeId, ruleId, outcome, limit, before));
    }
}
