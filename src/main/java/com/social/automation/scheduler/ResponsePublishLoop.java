package com.social.automation.scheduler;

import com.social.automation.config.AutomationConfig;
import com.social.automation.service.ResponsePublishingService;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ResponsePublishLoop extends PeriodicTask {

    private final ResponsePublishingService publishingService;

    public ResponsePublishLoop(ResponsePublishingService publishingService, AutomationConfig automationConfig) {
        super("response-publish-loop",
                Duration.ofSeconds(automationConfig.getPublishing().getIntervalSeconds()),
                Duration.ofSeconds(automationConfig.getPublishing().getIntervalSeconds()),
                automationConfig.getPublishing().isEnabled());
        this.publishingService = publishingService;
    }

    @Override
    public void tick() {
        publishingService.publishPending();
    }
}
