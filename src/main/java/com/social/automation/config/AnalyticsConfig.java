package com.social.automation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "automation.analytics")
public class AnalyticsConfig {
    private double anomalyThreshold = 0.3;               // fractional day-over-trailing-mean change
    private int lookbackDays = 28;
    private int windowDays = 30;
    private int topN = 5;
    private int secondsPerManualResponse = 45;
    private double hourlyRate = 30.0;
    private double costPerResponse = 0.005;
}
