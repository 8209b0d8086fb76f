package com.social.automation.config;

import com.social.automation.engine.Sleeper;
import com.social.automation.integration.Classifier;
import com.social.automation.integration.KeywordSafetyModerator;
import com.social.automation.integration.PassThroughClassifier;
import com.social.automation.integration.PlaceholderTemplateRenderer;
import com.social.automation.integration.ResponseHandoff;
import com.social.automation.integration.ResponsePublicationQueue;
import com.social.automation.integration.SafetyModerator;
import com.social.automation.integration.TemplateRenderer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;

/**
 * Fallback collaborators so the service boots without a platform integration.
 * A platform module replaces any of them by declaring its own bean.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public Classifier classifier() {
        return new PassThroughClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public TemplateRenderer templateRenderer(AutomationConfig automationConfig) {
        return new PlaceholderTemplateRenderer(automationConfig.getTemplates());
    }

    @Bean
    @ConditionalOnMissingBean
    public SafetyModerator safetyModerator() {
        return new KeywordSafetyModerator();
    }

    @Bean
    @ConditionalOnMissingBean(ResponseHandoff.class)
    public ResponsePublicationQueue responseHandoff(AutomationConfig automationConfig) {
        return new ResponsePublicationQueue(automationConfig.getPublishing().getQueueCapacity());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Random automationRandom() {
        return new Random();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }
}
