package com.social.automation.engine;

import com.social.automation.config.AutomationConfig;
import com.social.automation.model.AutomationRule;
import com.social.automation.model.ExecutionOutcome;
import com.social.automation.model.ExecutionRecord;
import com.social.automation.model.ItemStatus;
import com.social.automation.model.QueuedItem;
import com.social.automation.model.ScopeState;
import com.social.automation.model.action.ActionType;
import com.social.automation.repository.QueuedItemRepository;
import com.social.automation.repository.RuleRepository;
import com.social.automation.repository.ScopeRepository;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a scope's enabled rules over its pending items.
 * <p>
 * Items are taken in (priority desc, created-at asc) order and rules in priority order; the
 * first matching rule is the only one executed for an item, whatever its outcome. The run
 * stops once the plan's response cap is reached. Each item's status change is committed on
 * its own, so an interrupted run never leaves an item half-processed.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final RuleRepository ruleRepository;
    private final QueuedItemRepository queuedItemRepository;
    private final ScopeRepository scopeRepository;
    private final RuleMatcher ruleMatcher;
    private final ActionExecutor actionExecutor;
    private final AutomationConfig automationConfig;
    private final Tracer tracer;

    public RuleEngine(RuleRepository ruleRepository,
                      QueuedItemRepository queuedItemRepository,
                      ScopeRepository scopeRepository,
                      RuleMatcher ruleMatcher,
                      ActionExecutor actionExecutor,
                      AutomationConfig automationConfig,
                      Tracer tracer) {
        this.ruleRepository = ruleRepository;
        this.queuedItemRepository = queuedItemRepository;
        this.scopeRepository = scopeRepository;
        this.ruleMatcher = ruleMatcher;
        this.actionExecutor = actionExecutor;
        this.automationConfig = automationConfig;
        this.tracer = tracer;
    }

    public ScopeRunResult runScope(String scopeId) {
        List<AutomationRule> rules = ruleRepository.getEnabledRules(scopeId);
        RunPlan plan = RunPlan.from(rules, automationConfig.getCycle().getDefaultMaxResponses());
        Map<ExecutionOutcome, Integer> outcomes = new EnumMap<>(ExecutionOutcome.class);
        if (rules.isEmpty()) {
            return new ScopeRunResult(scopeId, 0, 0, outcomes, plan);
        }

        ScopeState scope = scopeRepository.findById(scopeId);
        ExecutionContext context = ExecutionContext.of(scopeId, scope != null ? scope.getOwnerAuthorId() : null);
        List<QueuedItem> items = queuedItemRepository.findPendingByScope(
                scopeId, automationConfig.getCycle().getPendingBatchSize());

        Span span = tracer.nextSpan()
                .name("automation.scope")
                .tag("scope.id", scopeId)
                .tag("rules", String.valueOf(rules.size()))
                .tag("pending", String.valueOf(items.size()))
                .start();

        int considered = 0;
        int executed = 0;
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            for (QueuedItem item : items) {
                if (executed >= plan.maxResponses() || Thread.currentThread().isInterrupted()) {
                    break;
                }
                considered++;

                AutomationRule matched = firstMatch(rules, item, context);
                if (matched == null) {
                    continue;
                }

                ExecutionRecord record = actionExecutor.execute(matched, item, context);
                outcomes.merge(record.getOutcome(), 1, Integer::sum);
                if (record.isSuccess()) {
                    executed++;
                }
                applyItemTransition(item, matched.getActionType(), record.getOutcome(), plan);
            }
            span.tag("executed", String.valueOf(executed));
        } finally {
            span.end();
        }

        if (executed > 0) {
            log.info("Scope {}: {} of {} items actioned (cap {}), outcomes={}",
                    scopeId, executed, considered, plan.maxResponses(), outcomes);
        } else {
            log.debug("Scope {}: no actions taken over {} pending items", scopeId, considered);
        }
        return new ScopeRunResult(scopeId, considered, executed, outcomes, plan);
    }

    private AutomationRule firstMatch(List<AutomationRule> rules, QueuedItem item, ExecutionContext context) {
        for (AutomationRule rule : rules) {
            if (ruleMatcher.matches(rule, item, context)) {
                return rule;
            }
        }
        return null;
    }

    /**
     * Status follow-up once the executor has dispatched. Flags move the item themselves;
     * rate-limited and failed executions leave it pending for the next tick.
     */
    private void applyItemTransition(QueuedItem item, ActionType type, ExecutionOutcome outcome, RunPlan plan) {
        ItemStatus target = switch (outcome) {
            case QUEUED_FOR_APPROVAL -> ItemStatus.NEEDS_REVIEW;
            case EXECUTED -> switch (type) {
                case RESPOND -> plan.autoPostAllowed() ? ItemStatus.PROCESSING : null;
                case DELETE -> ItemStatus.DONE;
                case FLAG -> null;
            };
            case DECLINED -> ItemStatus.DONE;
            case RATE_LIMITED, FAILED -> null;
        };
        if (target != null && !queuedItemRepository.transitionStatus(item.getItemId(), ItemStatus.PENDING, target)) {
            log.debug("Item {} changed concurrently, left as is", item.getItemId());
        }
    }
}
