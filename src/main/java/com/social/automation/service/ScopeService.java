package com.social.automation.service;

import com.social.automation.model.ScopeState;
import com.social.automation.repository.ScopeRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ScopeService {

    private final ScopeRepository scopeRepository;

    public ScopeService(ScopeRepository scopeRepository) {
        this.scopeRepository = scopeRepository;
    }

    public List<ScopeState> getAllScopes() {
        return scopeRepository.findAll();
    }

    public ScopeState getScope(String scopeId) {
        return scopeRepository.findById(scopeId);
    }

    /**
     * Register a scope for polling. An existing scope keeps its last poll time.
     */
    public ScopeState registerScope(ScopeState scope) {
        if (scope.getScopeId() == null || scope.getScopeId().isBlank()) {
            throw new IllegalArgumentException("scopeId is required");
        }
        if (scope.getPollIntervalMinutes() < 0) {
            throw new IllegalArgumentException("pollIntervalMinutes must not be negative");
        }
        ScopeState existing = scopeRepository.findById(scope.getScopeId());
        if (existing != null) {
            scope.setLastPolledAt(existing.getLastPolledAt());
        }
        scopeRepository.save(scope);
        return scope;
    }

    public ScopeState updateScope(String scopeId, ScopeState updated) {
        ScopeState existing = scopeRepository.findById(scopeId);
        if (existing == null) {
            return null;
        }
        if (updated.getPollIntervalMinutes() < 0) {
            throw new IllegalArgumentException("pollIntervalMinutes must not be negative");
        }
        if (updated.getOwnerAuthorId() != null) existing.setOwnerAuthorId(updated.getOwnerAuthorId());
        existing.setPollingEnabled(updated.isPollingEnabled());
        existing.setPollIntervalMinutes(updated.getPollIntervalMinutes());
        scopeRepository.save(existing);
        return existing;
    }
}
