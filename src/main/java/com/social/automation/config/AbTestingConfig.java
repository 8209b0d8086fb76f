package com.social.automation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "automation.ab-testing")
public class AbTestingConfig {
    private int minSamplesPerVariant = 50;
    private double significanceThreshold = 0.05;
    private double followUpThreshold = 0.2;
    private double winnerWeight = 0.7;
    private int optimizeIntervalMinutes = 60;
    private boolean autoPausePoorVariants = false;
}
