package com.social.automation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.social.automation.config.AerospikeConfig;
import com.social.automation.model.ApprovalEntry;
import com.social.automation.model.ApprovalStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Repository
public class ApprovalRepository {

    private static final Logger log = LoggerFactory.getLogger(ApprovalRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public ApprovalRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                              @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(ApprovalEntry entry) {
        Key key = key(entry.getApprovalId());
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        client.put(createOnly, key,
                new Bin("approvalId", entry.getApprovalId()),
                new Bin("scopeId", entry.getScopeId()),
                new Bin("itemId", entry.getItemId()),
                new Bin("responseId", entry.getResponseId()),
                new Bin("ruleId", entry.getRuleId()),
                new Bin("variantKey", entry.getVariantKey()),
                new Bin("payload", serializePayload(entry.getPayload())),
                new Bin("priority", entry.getPriority()),
                new Bin("status", entry.getStatus().name()),
                new Bin("createdAt", entry.getCreatedAt()),
                new Bin("updatedAt", entry.getUpdatedAt()),
                new Bin("autoApproveAt", entry.getAutoApproveAfter()),
                new Bin("approvedBy", entry.getApprovedBy()),
                new Bin("approvedAt", entry.getApprovedAt()),
                new Bin("reason", entry.getReason()),
                new Bin("urgent", entry.isUrgent()));
    }

    public ApprovalEntry findById(String approvalId) {
        Record record = client.get(readPolicy, key(approvalId));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * All pending entries, optionally restricted to one scope. Unordered.
     */
    public List<ApprovalEntry> findPending(String scopeId) {
        List<ApprovalEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_APPROVALS,
                (key, record) -> {
                    try {
                        if (!ApprovalStatus.PENDING.name().equals(record.getString("status"))) return;
                        if (scopeId != null && !scopeId.isEmpty()
                                && !scopeId.equals(record.getString("scopeId"))) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read approval record: {}", e.getMessage());
                    }
                });
        return results;
    }

    /**
     * Move a pending entry to a terminal status. Guarded by the record generation so an
     * operator approval and the expiry sweep cannot both win the same entry.
     * @return true if this caller performed the transition
     */
    public boolean transitionFromPending(String approvalId, ApprovalStatus target,
                                         String actor, String reason, long now) {
        Key key = key(approvalId);
        Record record = client.get(readPolicy, key);
        if (record == null) return false;

        String current = record.getString("status");
        if (!ApprovalStatus.PENDING.name().equals(current)) {
            log.debug("Approval {} already has status {}, skipping {}", approvalId, current, target);
            return false;
        }

        WritePolicy casPolicy = AerospikeConfig.casPolicy(writePolicy, record.generation);

        List<Bin> bins = new ArrayList<>();
        bins.add(new Bin("status", target.name()));
        bins.add(new Bin("updatedAt", now));
        if (target == ApprovalStatus.APPROVED || target == ApprovalStatus.AUTO_APPROVED) {
            bins.add(new Bin("approvedBy", actor));
            bins.add(new Bin("approvedAt", now));
        }
        if (reason != null) {
            bins.add(new Bin("reason", reason));
        }

        try {
            client.put(casPolicy, key, bins.toArray(new Bin[0]));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Lost approval race on {} ({})", approvalId, target);
                return false;
            }
            throw e;
        }
    }

    /**
     * Counts by status, plus the number of urgent entries still pending.
     */
    public ApprovalCounts countByStatus() {
        Map<ApprovalStatus, Integer> counts = new EnumMap<>(ApprovalStatus.class);
        for (ApprovalStatus status : ApprovalStatus.values()) {
            counts.put(status, 0);
        }
        int[] urgentPending = new int[1];
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_APPROVALS,
                (key, record) -> {
                    try {
                        ApprovalStatus status = ApprovalStatus.valueOf(record.getString("status"));
                        synchronized (counts) {
                            counts.merge(status, 1, Integer::sum);
                            if (status == ApprovalStatus.PENDING && record.getBoolean("urgent")) {
                                urgentPending[0]++;
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to count approval record: {}", e.getMessage());
                    }
                });
        return new ApprovalCounts(counts, urgentPending[0]);
    }

    public record ApprovalCounts(Map<ApprovalStatus, Integer> byStatus, int urgentPending) {}

    private Key key(String approvalId) {
        return new Key(namespace, AerospikeConfig.SET_APPROVALS, approvalId);
    }

    private ApprovalEntry mapRecord(Record record) {
        return ApprovalEntry.builder()
                .approvalId(record.getString("approvalId"))
                .scopeId(record.getString("scopeId"))
                .itemId(record.getString("itemId"))
                .responseId(record.getString("responseId"))
                .ruleId(record.getString("ruleId"))
                .variantKey(record.getString("variantKey"))
                .payload(deserializePayload(record.getString("payload")))
                .priority(record.getInt("priority"))
                .status(ApprovalStatus.valueOf(record.getString("status")))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .autoApproveAfter(record.getLong("autoApproveAt"))
                .approvedBy(record.getString("approvedBy"))
                .approvedAt(record.getLong("approvedAt"))
                .reason(record.getString("reason"))
                .urgent(record.getBoolean("urgent"))
                .build();
    }

    private String serializePayload(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload != null ? payload : Map.of());
        } catch (Exception e) {
            log.error("Failed to serialize approval payload", e);
            return "{}";
        }
    }

    private Map<String, Object> deserializePayload(String json) {
        if (json == null || json.isEmpty()) return new HashMap<>();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize approval payload", e);
            return new HashMap<>();
        }
    }
}
