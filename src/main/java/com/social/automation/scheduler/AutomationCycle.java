package com.social.automation.scheduler;

import com.social.automation.config.AutomationConfig;
import com.social.automation.config.MetricsConfig;
import com.social.automation.engine.RuleEngine;
import com.social.automation.engine.ScopeRunResult;
import com.social.automation.repository.RuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Top-level automation tick: reloads rules, then runs the rule engine for every scope with
 * enabled rules, one worker per scope. Workers for different scopes run in parallel; a scope
 * is never run by two workers at once. A failing scope does not affect the others.
 */
@Component
public class AutomationCycle extends PeriodicTask {

    private static final Logger log = LoggerFactory.getLogger(AutomationCycle.class);

    private final RuleEngine ruleEngine;
    private final RuleRepository ruleRepository;
    private final MetricsConfig metricsConfig;
    private final int workerThreads;
    private final AtomicInteger threadCount = new AtomicInteger();
    private final Set<String> inFlightScopes = ConcurrentHashMap.newKeySet();
    private ExecutorService workers;

    public AutomationCycle(RuleEngine ruleEngine,
                           RuleRepository ruleRepository,
                           AutomationConfig automationConfig,
                           MetricsConfig metricsConfig) {
        super("automation-cycle",
                Duration.ofSeconds(automationConfig.getCycle().getIntervalSeconds()),
                Duration.ofSeconds(10),
                automationConfig.getCycle().isEnabled());
        this.ruleEngine = ruleEngine;
        this.ruleRepository = ruleRepository;
        this.metricsConfig = metricsConfig;
        this.workerThreads = Math.max(1, automationConfig.getCycle().getWorkerThreads());
    }

    @Override
    public void tick() {
        run("scheduled");
    }

    /**
     * Run one full cycle on demand and wait for every scope worker.
     * @return results of the scopes that completed
     */
    public List<ScopeRunResult> runOnce() {
        return run("manual");
    }

    private List<ScopeRunResult> run(String trigger) {
        long started = System.currentTimeMillis();
        List<ScopeRunResult> results = runScopes();
        metricsConfig.recordCycle(trigger, results.size(), System.currentTimeMillis() - started);
        return results;
    }

    private List<ScopeRunResult> runScopes() {
        ruleRepository.refreshCache();
        Set<String> scopes = ruleRepository.getScopesWithEnabledRules();
        if (scopes.isEmpty()) {
            log.debug("Automation cycle: no scopes with enabled rules");
            return List.of();
        }

        List<String> claimed = new ArrayList<>();
        List<Callable<ScopeRunResult>> tasks = new ArrayList<>();
        for (String scopeId : scopes) {
            if (!inFlightScopes.add(scopeId)) {
                log.debug("Scope {} still running from a previous cycle, skipping", scopeId);
                continue;
            }
            claimed.add(scopeId);
            tasks.add(() -> runScope(scopeId));
        }

        List<ScopeRunResult> results = new ArrayList<>();
        try {
            for (Future<ScopeRunResult> future : workers().invokeAll(tasks)) {
                try {
                    ScopeRunResult result = future.get();
                    if (result != null) {
                        results.add(result);
                    }
                } catch (ExecutionException e) {
                    log.error("Scope worker died: {}", e.getCause().getMessage(), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // workers cancelled before starting never release their scope
            claimed.forEach(inFlightScopes::remove);
            log.info("Automation cycle interrupted, abandoning remaining scopes");
        } catch (RejectedExecutionException e) {
            claimed.forEach(inFlightScopes::remove);
            log.info("Scope workers shut down mid-cycle, abandoning remaining scopes");
        }

        int executed = results.stream().mapToInt(ScopeRunResult::executed).sum();
        if (executed > 0) {
            log.info("Automation cycle complete: {} scopes, {} actions", results.size(), executed);
        }
        return results;
    }

    private ScopeRunResult runScope(String scopeId) {
        try {
            return ruleEngine.runScope(scopeId);
        } catch (Exception e) {
            metricsConfig.recordScopeFailure("automation");
            log.error("Automation run for scope {} failed: {}", scopeId, e.getMessage(), e);
            return null;
        } finally {
            inFlightScopes.remove(scopeId);
        }
    }

    private synchronized ExecutorService workers() {
        if (workers == null || workers.isShutdown()) {
            workers = Executors.newFixedThreadPool(workerThreads, r -> {
                Thread t = new Thread(r, "scope-worker-" + threadCount.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        return workers;
    }

    /**
     * Interrupts running scope workers. The next cycle, scheduled or manual, starts a fresh pool.
     */
    @Override
    protected void onStop() {
        ExecutorService running;
        synchronized (this) {
            running = workers;
            workers = null;
        }
        if (running != null) {
            running.shutdownNow();
        }
    }
}
