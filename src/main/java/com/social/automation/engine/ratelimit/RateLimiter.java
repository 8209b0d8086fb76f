package com.social.automation.engine.ratelimit;

/**
 * Admission control over fixed one-minute windows keyed by scope. Advisory backpressure,
 * not a hard quota.
 */
public interface RateLimiter {

    /**
     * Count one action against the scope's current window.
     *
     * @return false once the window's counter has reached {@code perMinuteLimit}
     */
    boolean allow(String scopeKey, int perMinuteLimit);
}
