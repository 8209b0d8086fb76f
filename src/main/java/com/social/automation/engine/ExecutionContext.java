package com.social.automation.engine;

import java.util.Map;

/**
 * Scope-level facts available to rule matching and template rendering.
 */
public record ExecutionContext(String scopeId, String ownerAuthorId, Map<String, String> attributes) {

    public static ExecutionContext of(String scopeId, String ownerAuthorId) {
        return new ExecutionContext(scopeId, ownerAuthorId, Map.of());
    }
}
