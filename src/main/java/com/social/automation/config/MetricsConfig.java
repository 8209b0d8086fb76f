package com.social.automation.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger urgentPendingCount;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.urgentPendingCount = registry.gauge("approval.pending.urgent", new AtomicInteger(0));
    }

    public void recordExecution(String action, String outcome, long durationMs) {
        Counter.builder("automation.execution.count")
                .tag("action", action)
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        Timer.builder("automation.execution.duration")
                .tag("action", action)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordCycle(String trigger, int scopes, long durationMs) {
        Timer.builder("automation.cycle.duration")
                .tag("trigger", trigger)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        registry.summary("automation.cycle.scopes").record(scopes);
    }

    public void recordRateLimitDenied(String action) {
        Counter.builder("automation.ratelimit.denied")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordItemsEnqueued(int count) {
        Counter.builder("automation.polling.enqueued")
                .register(registry)
                .increment(count);
    }

    public void recordScopeFailure(String loop) {
        Counter.builder("automation.cycle.scope.failed")
                .tag("loop", loop)
                .register(registry)
                .increment();
    }

    public void recordApprovalEnqueued(boolean urgent) {
        Counter.builder("approval.enqueued")
                .tag("urgent", String.valueOf(urgent))
                .register(registry)
                .increment();
    }

    public void recordApprovalTransition(String status, int count) {
        Counter.builder("approval.transition")
                .tag("status", status)
                .register(registry)
                .increment(count);
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordVariantReweight(String reason) {
        Counter.builder("abtest.reweight.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void updateUrgentPendingCount(int count) {
        urgentPendingCount.set(count);
    }
}
