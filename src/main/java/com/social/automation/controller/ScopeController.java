package com.social.automation.controller;

import com.social.automation.model.ScopeState;
import com.social.automation.service.ScopeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/scopes")
@Tag(name = "Scopes", description = "Sources registered for polling")
public class ScopeController {

    private final ScopeService scopeService;

    public ScopeController(ScopeService scopeService) {
        this.scopeService = scopeService;
    }

    @GetMapping
    @Operation(summary = "List registered scopes")
    public ResponseEntity<List<ScopeState>> listScopes() {
        return ResponseEntity.ok(scopeService.getAllScopes());
    }

    @PostMapping
    @Operation(summary = "Register a scope", description = "Registers or replaces a scope's polling settings")
    public ResponseEntity<?> registerScope(@RequestBody ScopeState scope) {
        try {
            return ResponseEntity.ok(scopeService.registerScope(scope));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PutMapping("/{scopeId}")
    @Operation(summary = "Update a scope", description = "Enable/disable polling, change interval or owner")
    public ResponseEntity<?> updateScope(@PathVariable String scopeId, @RequestBody ScopeState updated) {
        try {
            ScopeState result = scopeService.updateScope(scopeId, updated);
            if (result == null) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
