package com.social.automation.engine.ratelimit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single-process limiter. Each scope's window is updated under the map's per-key lock.
 */
@Component
@ConditionalOnProperty(prefix = "automation.rate-limit", name = "backend", havingValue = "memory",
        matchIfMissing = true)
public class InMemoryRateLimiter implements RateLimiter {

    private final Clock clock;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    public InMemoryRateLimiter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean allow(String scopeKey, int perMinuteLimit) {
        long currentWindow = clock.millis() / 60_000L;
        boolean[] allowed = new boolean[1];
        windows.compute(scopeKey, (key, window) -> {
            if (window == null || window.minute != currentWindow) {
                window = new Window(currentWindow, 0);
            }
            if (window.count >= perMinuteLimit) {
                allowed[0] = false;
                return window;
            }
            allowed[0] = true;
            return new Window(currentWindow, window.count + 1);
        });
        return allowed[0];
    }

    private record Window(long minute, int count) {}
}
