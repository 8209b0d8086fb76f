package com.social.automation.engine;

import com.social.automation.config.AutomationConfig;
import com.social.automation.config.MetricsConfig;
import com.social.automation.engine.abtest.VariantSelector;
import com.social.automation.engine.ratelimit.RateLimiter;
import com.social.automation.integration.ResponseHandoff;
import com.social.automation.integration.SafetyModerator;
import com.social.automation.integration.SourceConnector;
import com.social.automation.integration.TemplateRenderer;
import com.social.automation.model.ApprovalEntry;
import com.social.automation.model.AutomationRule;
import com.social.automation.model.DeleteDecision;
import com.social.automation.model.ExecutionOutcome;
import com.social.automation.model.ExecutionRecord;
import com.social.automation.model.ItemStatus;
import com.social.automation.model.QueuedItem;
import com.social.automation.model.Variant;
import com.social.automation.model.VariantKey;
import com.social.automation.model.action.ActionType;
import com.social.automation.model.action.DeleteConfig;
import com.social.automation.model.action.RespondConfig;
import com.social.automation.repository.DailyOutcomeRepository;
import com.social.automation.repository.ExecutionLogRepository;
import com.social.automation.repository.OutcomeMetricRepository;
import com.social.automation.repository.QueuedItemRepository;
import com.social.automation.service.ApprovalQueueService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Executes one matched rule against one queued item: admission, pacing, variant selection,
 * rendering or safety gating, dispatch, and logging. Never throws for dispatch failures;
 * they come back as a {@code FAILED} record.
 */
@Component
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final RateLimiter rateLimiter;
    private final PacingDelay pacingDelay;
    private final VariantSelector variantSelector;
    private final TemplateRenderer templateRenderer;
    private final SafetyModerator safetyModerator;
    private final ResponseHandoff responseHandoff;
    private final ApprovalQueueService approvalQueue;
    private final ObjectProvider<SourceConnector> connectorProvider;
    private final QueuedItemRepository queuedItemRepo;
    private final ExecutionLogRepository executionLogRepo;
    private final OutcomeMetricRepository outcomeRepo;
    private final DailyOutcomeRepository dailyOutcomeRepo;
    private final AutomationConfig automationConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ActionExecutor(RateLimiter rateLimiter,
                          PacingDelay pacingDelay,
                          VariantSelector variantSelector,
                          TemplateRenderer templateRenderer,
                          SafetyModerator safetyModerator,
                          ResponseHandoff responseHandoff,
                          ApprovalQueueService approvalQueue,
                          ObjectProvider<SourceConnector> connectorProvider,
                          QueuedItemRepository queuedItemRepo,
                          ExecutionLogRepository executionLogRepo,
                          OutcomeMetricRepository outcomeRepo,
                          DailyOutcomeRepository dailyOutcomeRepo,
                          AutomationConfig automationConfig,
                          MetricsConfig metricsConfig,
                          Clock clock) {
        this.rateLimiter = rateLimiter;
        this.pacingDelay = pacingDelay;
        this.variantSelector = variantSelector;
        this.templateRenderer = templateRenderer;
        this.safetyModerator = safetyModerator;
        this.responseHandoff = responseHandoff;
        this.approvalQueue = approvalQueue;
        this.connectorProvider = connectorProvider;
        this.queuedItemRepo = queuedItemRepo;
        this.executionLogRepo = executionLogRepo;
        this.outcomeRepo = outcomeRepo;
        this.dailyOutcomeRepo = dailyOutcomeRepo;
        this.automationConfig = automationConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "action.execute", contextualName = "execute-action")
    public ExecutionRecord execute(AutomationRule rule, QueuedItem item, ExecutionContext context) {
        long started = clock.millis();
        ActionType type = rule.getActionType();
        String executionId = UUID.randomUUID().toString();
        ExecutionRecord.ExecutionRecordBuilder record = ExecutionRecord.builder()
                .executionId(executionId)
                .ruleId(rule.getRuleId())
                .itemId(item.getItemId())
                .scopeId(context.scopeId())
                .actionType(type)
                .actionJson(describeAction(rule))
                .context(contextSnapshot(item, context));

        // rate-limit denials are not written to the execution log
        if (!rateLimiter.allow(context.scopeId(), automationConfig.getRateLimit().limitFor(type))) {
            log.debug("Rate limited; skipping {} for item {} in scope {}", type, item.getItemId(), context.scopeId());
            metricsConfig.recordRateLimitDenied(type.name());
            return record.outcome(ExecutionOutcome.RATE_LIMITED)
                    .detail("rate limited")
                    .executedAt(started)
                    .build();
        }

        try {
            pacingDelay.pause(type);

            switch (type) {
                case RESPOND -> respond(rule, item, context, executionId, record);
                case DELETE -> delete(rule, item, context, record);
                case FLAG -> flag(item, record);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Execution of rule {} on item {} interrupted before dispatch", rule.getRuleId(), item.getItemId());
            record.outcome(ExecutionOutcome.FAILED).detail("interrupted before dispatch");
        } catch (Exception e) {
            log.error("Dispatch of {} for item {} (rule {}) failed: {}",
                    type, item.getItemId(), rule.getRuleId(), e.getMessage(), e);
            record.outcome(ExecutionOutcome.FAILED).detail(e.getMessage());
        }

        // every dispatched attempt is logged, whatever its outcome
        long finished = clock.millis();
        ExecutionRecord result = record.durationMs(finished - started).executedAt(finished).build();
        try {
            executionLogRepo.save(result);
        } catch (Exception e) {
            log.error("Failed to write execution record {} for item {}: {}",
                    result.getExecutionId(), item.getItemId(), e.getMessage(), e);
        }
        metricsConfig.recordExecution(type.name(), result.getOutcome().name(), result.getDurationMs());
        return result;
    }

    private void respond(AutomationRule rule, QueuedItem item, ExecutionContext context,
                         String executionId, ExecutionRecord.ExecutionRecordBuilder record) {
        RespondConfig config = (RespondConfig) rule.getAction();
        VariantKey variant = variantSelector.selectVariant(rule);
        record.variantKey(variant.encode());

        Variant definition = variantSelector.findVariant(rule, variant);
        String templateRef = definition != null && definition.getTemplateRef() != null
                ? definition.getTemplateRef() : config.getTemplateRef();

        Map<String, String> renderContext = new HashMap<>(context.attributes());
        renderContext.put("username", item.getAuthorId() != null ? item.getAuthorId() : "");
        renderContext.put("comment_text", item.getText() != null ? item.getText() : "");
        renderContext.put("scope_id", context.scopeId());
        renderContext.put("content_id", item.getContentId() != null ? item.getContentId() : "");
        renderContext.put("style", config.getStyle());
        String text = templateRenderer.render(templateRef, renderContext);
        if (text == null || text.isBlank()) {
            record.outcome(ExecutionOutcome.FAILED).detail("template '" + templateRef + "' rendered empty");
            return;
        }

        if (rule.isRequireApproval()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("action", "respond");
            payload.put("responseText", text);
            payload.put("templateRef", templateRef);
            payload.put("commentText", item.getText());
            ApprovalEntry entry = approvalQueue.addToQueue(ApprovalEntry.builder()
                    .scopeId(context.scopeId())
                    .itemId(item.getItemId())
                    .responseId(executionId)
                    .ruleId(rule.getRuleId())
                    .variantKey(variant.encode())
                    .payload(payload)
                    .priority(item.getPriority())
                    .build(), null);
            record.outcome(ExecutionOutcome.QUEUED_FOR_APPROVAL).detail("approval " + entry.getApprovalId());
        } else if (responseHandoff.handOff(item, text)) {
            record.outcome(ExecutionOutcome.EXECUTED);
        } else {
            record.outcome(ExecutionOutcome.FAILED).detail("response handoff rejected");
            return;
        }

        // impressions count from dispatch; clicks and conversions arrive later as feedback
        outcomeRepo.recordImpression(rule.getRuleId(), variant);
        dailyOutcomeRepo.recordResponse(rule.getRuleId(), LocalDate.now(clock.withZone(ZoneOffset.UTC)), true);
    }

    private void delete(AutomationRule rule, QueuedItem item, ExecutionContext context,
                        ExecutionRecord.ExecutionRecordBuilder record) {
        DeleteConfig config = (DeleteConfig) rule.getAction();
        DeleteDecision decision = safetyModerator.evaluateDeleteCriteria(item, config.getDeleteCriteria());

        if (!decision.isRecommendedDelete()) {
            log.info("Delete skipped item={} conf={} thr={} legit={} reason={}",
                    item.getItemId(),
                    String.format("%.3f", decision.getConfidence()),
                    String.format("%.3f", decision.getThreshold()),
                    decision.isLegitimate(),
                    decision.getReason());
            record.outcome(ExecutionOutcome.DECLINED).detail(decision.getReason());
            return;
        }

        SourceConnector connector = connectorProvider.getIfAvailable();
        if (connector == null) {
            record.outcome(ExecutionOutcome.FAILED).detail("no source connector configured");
            return;
        }
        boolean deleted = connector.deleteItem(context.scopeId(), item.getItemId());
        record.outcome(deleted ? ExecutionOutcome.EXECUTED : ExecutionOutcome.FAILED)
                .detail(deleted ? decision.getReason() : "platform delete returned false");
    }

    private void flag(QueuedItem item, ExecutionRecord.ExecutionRecordBuilder record) {
        boolean flagged = queuedItemRepo.transitionStatus(item.getItemId(), ItemStatus.PENDING, ItemStatus.NEEDS_REVIEW);
        if (flagged) {
            record.outcome(ExecutionOutcome.EXECUTED);
        } else {
            record.outcome(ExecutionOutcome.FAILED).detail("item no longer pending");
        }
    }

    private Map<String, String> contextSnapshot(QueuedItem item, ExecutionContext context) {
        Map<String, String> snapshot = new LinkedHashMap<>(context.attributes());
        snapshot.put("scopeId", context.scopeId());
        if (item.getClassification() != null) snapshot.put("classification", item.getClassification());
        if (item.getAuthorId() != null) snapshot.put("authorId", item.getAuthorId());
        return snapshot;
    }

    private String describeAction(AutomationRule rule) {
        try {
            return objectMapper.writeValueAsString(rule.getAction());
        } catch (Exception e) {
            log.warn("Could not serialize action of rule {}: {}", rule.getRuleId(), e.getMessage());
            return null;
        }
    }
}
