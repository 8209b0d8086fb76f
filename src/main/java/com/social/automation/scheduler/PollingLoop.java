package com.social.automation.scheduler;

import com.social.automation.config.AutomationConfig;
import com.social.automation.service.PollingService;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class PollingLoop extends PeriodicTask {

    private final PollingService pollingService;

    public PollingLoop(PollingService pollingService, AutomationConfig automationConfig) {
        super("polling-loop",
                Duration.ofSeconds(automationConfig.getPolling().getIntervalSeconds()),
                Duration.ofSeconds(5),
                automationConfig.getPolling().isEnabled());
        this.pollingService = pollingService;
    }

    @Override
    public void tick() {
        pollingService.pollDueScopes();
    }
}
