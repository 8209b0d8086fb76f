package com.social.automation.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Aerospike connection and shared policies. Every set the service writes lives in one
 * namespace; status changes that must not be lost to a concurrent writer go through
 * {@link #casPolicy(WritePolicy, int)}.
 */
@Configuration
public class AerospikeConfig {

    public static final String SET_QUEUED_ITEMS = "queued_items";
    public static final String SET_AUTOMATION_RULES = "automation_rules";
    public static final String SET_APPROVALS = "approval_queue";
    public static final String SET_EXECUTION_LOG = "execution_log";
    public static final String SET_VARIANT_OUTCOMES = "variant_outcomes";
    public static final String SET_DAILY_OUTCOMES = "daily_rule_outcomes";
    public static final String SET_SCOPES = "scopes";
    public static final String SET_LEARNING_EVENTS = "learning_events";
    public static final String SET_WEIGHT_HISTORY = "variant_weight_hist";
    public static final String SET_RATE_WINDOWS = "rate_windows";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:automation}")
    private String namespace;

    @Value("${aerospike.total-timeout-ms:3000}")
    private int totalTimeoutMs;

    @Value("${aerospike.socket-timeout-ms:1000}")
    private int socketTimeoutMs;

    @Bean
    @ConditionalOnProperty(name = "aerospike.connect", havingValue = "true", matchIfMissing = true)
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 100;
        clientPolicy.timeout = 5000;
        clientPolicy.readPolicyDefault = defaultReadPolicy();
        clientPolicy.writePolicyDefault = defaultWritePolicy();
        return new AerospikeClient(clientPolicy, host, port);
    }

    /**
     * Writes store the user key with the record so scans of key-only sets (rate windows,
     * outcome counters) can still be traced back to their scope or rule.
     */
    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        policy.sendKey = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = totalTimeoutMs;
        policy.socketTimeout = socketTimeoutMs;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }

    /**
     * Update-only write that fails with {@code GENERATION_ERROR} unless the record is still
     * at the generation the caller read.
     */
    public static WritePolicy casPolicy(WritePolicy base, int generation) {
        WritePolicy cas = new WritePolicy(base);
        cas.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        cas.generation = generation;
        cas.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        return cas;
    }
}
