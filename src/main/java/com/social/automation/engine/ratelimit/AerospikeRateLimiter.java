package com.social.automation.engine.ratelimit;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.WritePolicy;
import com.social.automation.config.AerospikeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Shared-store limiter for multi-process deployments. Each (scope, minute) window is one
 * Aerospike record incremented atomically; records expire shortly after their minute ends.
 * An increment past the limit is still counted, which only affects the denied window.
 */
@Component
@ConditionalOnProperty(prefix = "automation.rate-limit", name = "backend", havingValue = "aerospike")
public class AerospikeRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(AerospikeRateLimiter.class);
    private static final int WINDOW_TTL_SECONDS = 120;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy counterPolicy;
    private final Clock clock;

    public AerospikeRateLimiter(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                Clock clock) {
        this.client = client;
        this.namespace = namespace;
        this.counterPolicy = new WritePolicy(writePolicy);
        this.counterPolicy.expiration = WINDOW_TTL_SECONDS;
        this.clock = clock;
    }

    @Override
    public boolean allow(String scopeKey, int perMinuteLimit) {
        long minute = clock.millis() / 60_000L;
        Key key = new Key(namespace, AerospikeConfig.SET_RATE_WINDOWS, scopeKey + ":" + minute);
        Record record = client.operate(counterPolicy, key,
                Operation.add(new Bin("count", 1L)),
                Operation.get("count"));
        long count = record != null ? record.getLong("count") : 1L;
        if (count > perMinuteLimit) {
            log.debug("Scope {} over limit in window {}: {} > {}", scopeKey, minute, count, perMinuteLimit);
            return false;
        }
        return true;
    }
}
