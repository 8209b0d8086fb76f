package com.social.automation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.social.automation.config.AerospikeConfig;
import com.social.automation.config.AutomationConfig;
import com.social.automation.model.ExecutionOutcome;
import com.social.automation.model.ExecutionRecord;
import com.social.automation.model.PagedResponse;
import com.social.automation.model.action.ActionType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only execution log. Records expire through the Aerospike TTL after the
 * configured retention period.
 */
@Repository
public class ExecutionLogRepository {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLogRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy appendPolicy;
    private final ObjectMapper objectMapper;

    public ExecutionLogRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  AutomationConfig automationConfig) {
        this.client = client;
        this.namespace = namespace;
        this.appendPolicy = new WritePolicy(writePolicy);
        this.appendPolicy.expiration = automationConfig.getExecutionLog().getRetentionDays() * 86_400;
        this.objectMapper = new ObjectMapper();
    }

    public void save(ExecutionRecord record) {
        Key key = new Key(namespace, AerospikeConfig.SET_EXECUTION_LOG, record.getExecutionId());

        client.put(appendPolicy, key,
                new Bin("executionId", record.getExecutionId()),
                new Bin("ruleId", record.getRuleId()),
                new Bin("itemId", record.getItemId()),
                new Bin("scopeId", record.getScopeId()),
                new Bin("actionType", record.getActionType() != null ? record.getActionType().name() : null),
                new Bin("actionJson", record.getActionJson()),
                new Bin("variantKey", record.getVariantKey()),
                new Bin("outcome", record.getOutcome().name()),
                new Bin("detail", record.getDetail()),
                new Bin("context", serializeContext(record.getContext())),
                new Bin("durationMs", record.getDurationMs()),
                new Bin("executedAt", record.getExecutedAt()));
    }

    public PagedResponse<ExecutionRecord> findByFilters(String scopeId, String ruleId, String outcome,
                                                        int limit, Long before) {
        List<ExecutionRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_EXECUTION_LOG,
                (key, record) -> {
                    try {
                        if (scopeId != null && !scopeId.isEmpty()
                                && !scopeId.equals(record.getString("scopeId"))) return;
                        if (ruleId != null && !ruleId.isEmpty()
                                && !ruleId.equals(record.getString("ruleId"))) return;
                        if (outcome != null && !outcome.isEmpty()
                                && !outcome.equalsIgnoreCase(record.getString("outcome"))) return;
                        if (before != null && record.getLong("executedAt") >= before) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read execution log record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(ExecutionRecord::getExecutedAt).reversed());
        boolean hasMore = results.size() > limit;
        List<ExecutionRecord> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getExecutedAt()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    private ExecutionRecord mapRecord(Record record) {
        String actionType = record.getString("actionType");
        return ExecutionRecord.builder()
                .executionId(record.getString("executionId"))
                .ruleId(record.getString("ruleId"))
                .itemId(record.getString("itemId"))
                .scopeId(record.getString("scopeId"))
                .actionType(actionType != null ? ActionType.valueOf(actionType) : null)
                .actionJson(record.getString("actionJson"))
                .variantKey(record.getString("variantKey"))
                .outcome(ExecutionOutcome.valueOf(record.getString("outcome")))
                .detail(record.getString("detail"))
                .context(deserializeContext(record.getString("context")))
                .durationMs(record.getLong("durationMs"))
                .executedAt(record.getLong("executedAt"))
                .build();
    }

    private String serializeContext(Map<String, String> context) {
        try {
            return objectMapper.writeValueAsString(context != null ? context : Map.of());
        } catch (Exception e) {
            log.error("Failed to serialize execution context", e);
            return "{}";
        }
    }

    private Map<String, String> deserializeContext(String json) {
        if (json == null || json.isEmpty()) return new HashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize execution context", e);
            return new HashMap<>();
        }
    }
}
