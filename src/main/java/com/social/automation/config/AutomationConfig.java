package com.social.automation.config;

import com.social.automation.model.action.ActionType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "automation")
public class AutomationConfig {

    private Polling polling = new Polling();
    private Cycle cycle = new Cycle();
    private RateLimit rateLimit = new RateLimit();
    private Pacing pacing = new Pacing();
    private ExecutionLog executionLog = new ExecutionLog();
    private Publishing publishing = new Publishing();

    /** templateRef -> template text with {placeholder} tokens */
    private Map<String, String> templates = new HashMap<>();

    @Data
    public static class Polling {
        private boolean enabled = true;
        private int intervalSeconds = 60;
        private int defaultPollIntervalMinutes = 15;
        private int initialLookbackHours = 48;
    }

    @Data
    public static class Cycle {
        private boolean enabled = true;
        private int intervalSeconds = 300;
        private int defaultMaxResponses = 20;
        private int pendingBatchSize = 100;
        private int workerThreads = 4;
    }

    @Data
    public static class RateLimit {
        private String backend = "memory";      // "memory" or "aerospike"
        private int respondPerMinute = 30;
        private int deletePerMinute = 15;
        private int flagPerMinute = 60;

        public int limitFor(ActionType type) {
            return switch (type) {
                case RESPOND -> respondPerMinute;
                case DELETE -> deletePerMinute;
                case FLAG -> flagPerMinute;
            };
        }
    }

    @Data
    public static class Pacing {
        private boolean enabled = true;
        private long respondMinMs = 800;
        private long respondMaxMs = 2000;
        private long deleteMinMs = 1000;
        private long deleteMaxMs = 2500;
        private long flagMinMs = 500;
        private long flagMaxMs = 1500;

        public long minFor(ActionType type) {
            return switch (type) {
                case RESPOND -> respondMinMs;
                case DELETE -> deleteMinMs;
                case FLAG -> flagMinMs;
            };
        }

        public long maxFor(ActionType type) {
            return switch (type) {
                case RESPOND -> respondMaxMs;
                case DELETE -> deleteMaxMs;
                case FLAG -> flagMaxMs;
            };
        }
    }

    @Data
    public static class Publishing {
        private boolean enabled = true;
        private int intervalSeconds = 5;
        private int queueCapacity = 1000;
        private int batchSize = 50;
        private int maxAttempts = 3;
    }

    @Data
    public static class ExecutionLog {
        private int retentionDays = 90;
    }
}
