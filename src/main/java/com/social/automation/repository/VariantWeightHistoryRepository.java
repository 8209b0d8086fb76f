package com.social.automation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.social.automation.config.AerospikeConfig;
import com.social.automation.model.PagedResponse;
import com.social.automation.model.VariantWeightChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class VariantWeightHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(VariantWeightHistoryRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public VariantWeightHistoryRepository(AerospikeClient client,
                                          @Qualifier("aerospikeNamespace") String namespace,
                                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(VariantWeightChange change) {
        String recordKey = change.getRuleId() + "_" + change.getTestId() + "_"
                + change.getVariantId() + "_" + change.getAdjustedAt();
        Key key = new Key(namespace, AerospikeConfig.SET_WEIGHT_HISTORY, recordKey);

        client.put(writePolicy, key,
                new Bin("ruleId", change.getRuleId()),
                new Bin("testId", change.getTestId()),
                new Bin("variantId", change.getVariantId()),
                new Bin("oldWeight", change.getOldWeight()),
                new Bin("newWeight", change.getNewWeight()),
                new Bin("reason", change.getReason()),
                new Bin("pValue", change.getPValue()),
                new Bin("adjustedAt", change.getAdjustedAt()));
    }

    public PagedResponse<VariantWeightChange> findByRuleId(String ruleId, int limit, Long before) {
        List<VariantWeightChange> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_WEIGHT_HISTORY,
                (key, record) -> {
                    try {
                        if (!ruleId.equals(record.getString("ruleId"))) return;
                        if (before != null && record.getLong("adjustedAt") >= before) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read weight history record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(VariantWeightChange::getAdjustedAt).reversed());
        boolean hasMore = results.size() > limit;
        List<VariantWeightChange> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getAdjustedAt()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    private VariantWeightChange mapRecord(Record record) {
        return VariantWeightChange.builder()
                .ruleId(record.getString("ruleId"))
                .testId(record.getString("testId"))
                .variantId(record.getString("variantId"))
                .oldWeight(record.getDouble("oldWeight"))
                .newWeight(record.getDouble("newWeight"))
                .reason(record.getString("reason"))
                .pValue(record.getDouble("pValue"))
                .adjustedAt(record.getLong("adjustedAt"))
                .build();
    }
}
