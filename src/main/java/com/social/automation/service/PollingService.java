package com.social.automation.service;

import com.social.automation.config.AutomationConfig;
import com.social.automation.config.MetricsConfig;
import com.social.automation.integration.Classification;
import com.social.automation.integration.Classifier;
import com.social.automation.integration.ContentRef;
import com.social.automation.integration.RawItem;
import com.social.automation.integration.SourceConnector;
import com.social.automation.model.ItemStatus;
import com.social.automation.model.QueuedItem;
import com.social.automation.model.ScopeState;
import com.social.automation.repository.QueuedItemRepository;
import com.social.automation.repository.ScopeRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Ingests new child items (comments) of recently published content into the queue.
 */
@Service
public class PollingService {

    private static final Logger log = LoggerFactory.getLogger(PollingService.class);

    private final ObjectProvider<SourceConnector> connectorProvider;
    private final Classifier classifier;
    private final QueuedItemRepository queuedItemRepo;
    private final ScopeRepository scopeRepo;
    private final AutomationConfig automationConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public PollingService(ObjectProvider<SourceConnector> connectorProvider,
                          Classifier classifier,
                          QueuedItemRepository queuedItemRepo,
                          ScopeRepository scopeRepo,
                          AutomationConfig automationConfig,
                          MetricsConfig metricsConfig,
                          Clock clock) {
        this.connectorProvider = connectorProvider;
        this.classifier = classifier;
        this.queuedItemRepo = queuedItemRepo;
        this.scopeRepo = scopeRepo;
        this.automationConfig = automationConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * True if the scope has never been polled or its poll interval has elapsed.
     */
    public boolean shouldPoll(String scopeId) {
        ScopeState scope = scopeRepo.findById(scopeId);
        return scope != null && shouldPoll(scope, clock.millis());
    }

    boolean shouldPoll(ScopeState scope, long now) {
        if (scope.getLastPolledAt() <= 0) {
            return true;
        }
        int minutes = scope.getPollIntervalMinutes() > 0
                ? scope.getPollIntervalMinutes()
                : automationConfig.getPolling().getDefaultPollIntervalMinutes();
        return now >= scope.getLastPolledAt() + minutes * 60_000L;
    }

    /**
     * Poll every enabled scope that is due. A failing scope is logged and skipped.
     * @return total number of newly queued items
     */
    @Observed(name = "polling.tick", contextualName = "poll-due-scopes")
    public int pollDueScopes() {
        long now = clock.millis();
        int total = 0;
        for (ScopeState scope : scopeRepo.findPollingEnabled()) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            if (!shouldPoll(scope, now)) {
                continue;
            }
            try {
                total += pollScope(scope);
            } catch (Exception e) {
                metricsConfig.recordScopeFailure("polling");
                log.error("Polling scope {} failed: {}", scope.getScopeId(), e.getMessage(), e);
            }
        }
        if (total > 0) {
            log.info("Polling tick queued {} new items", total);
        }
        return total;
    }

    /**
     * Fetch and queue unseen items of one scope, then stamp the poll time.
     * @return number of newly queued items
     */
    public int pollScope(String scopeId) {
        ScopeState scope = scopeRepo.findById(scopeId);
        if (scope == null) {
            throw new IllegalArgumentException("Unknown scope: " + scopeId);
        }
        return pollScope(scope);
    }

    private int pollScope(ScopeState scope) {
        SourceConnector connector = connectorProvider.getIfAvailable();
        if (connector == null) {
            log.debug("No source connector configured, skipping poll of scope {}", scope.getScopeId());
            return 0;
        }

        long now = clock.millis();
        long since = scope.getLastPolledAt() > 0
                ? scope.getLastPolledAt()
                : now - automationConfig.getPolling().getInitialLookbackHours() * 3_600_000L;

        int enqueued = 0;
        List<ContentRef> contents = connector.listNewParentContent(scope.getScopeId(), since);
        for (ContentRef content : contents) {
            try {
                for (RawItem raw : connector.listNewChildItems(scope.getScopeId(), content)) {
                    if (enqueue(scope.getScopeId(), content, raw, now)) {
                        enqueued++;
                    }
                }
            } catch (Exception e) {
                log.warn("Failed to fetch items of content {} in scope {}: {}",
                        content.contentId(), scope.getScopeId(), e.getMessage());
            }
        }

        scopeRepo.updateLastPolledAt(scope.getScopeId(), now);
        if (enqueued > 0) {
            metricsConfig.recordItemsEnqueued(enqueued);
        }
        log.debug("Polled scope {}: {} contents, {} new items", scope.getScopeId(), contents.size(), enqueued);
        return enqueued;
    }

    private boolean enqueue(String scopeId, ContentRef content, RawItem raw, long now) {
        if (raw.itemId() == null || raw.itemId().isBlank()) {
            return false;
        }
        return queuedItemRepo.insertIfAbsent(QueuedItem.builder()
                .itemId(raw.itemId())
                .scopeId(scopeId)
                .contentId(content.contentId())
                .text(raw.text())
                .classification(classify(raw))
                .authorId(raw.authorId())
                .authorStatus(raw.authorStatus())
                .status(ItemStatus.PENDING)
                .priority(0)
                .createdAt(raw.createdAt() > 0 ? raw.createdAt() : now)
                .updatedAt(now)
                .build());
    }

    private String classify(RawItem raw) {
        if (raw.text() == null || raw.text().isBlank()) {
            return null;
        }
        try {
            Classification classification = classifier.classify(raw.text());
            return classification != null ? classification.label() : null;
        } catch (Exception e) {
            log.warn("Classification of item {} failed, queuing unlabelled: {}", raw.itemId(), e.getMessage());
            return null;
        }
    }
}
