package com.social.automation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.social.automation.config.AerospikeConfig;
import com.social.automation.model.OutcomeMetric;
import com.social.automation.model.VariantKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Per (rule, test, variant) counters, incremented atomically with server-side adds so
 * concurrent scope workers never lose an update.
 */
@Repository
public class OutcomeMetricRepository {

    private static final Logger log = LoggerFactory.getLogger(OutcomeMetricRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public OutcomeMetricRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void recordImpression(String ruleId, VariantKey variant) {
        client.operate(writePolicy, key(ruleId, variant),
                Operation.put(new Bin("ruleId", ruleId)),
                Operation.put(new Bin("testId", variant.testId())),
                Operation.put(new Bin("variantId", variant.variantId())),
                Operation.add(new Bin("samples", 1L)),
                Operation.add(new Bin("impressions", 1L)));
    }

    public void recordFeedback(String ruleId, VariantKey variant,
                               long impressions, long conversions, Double engagement) {
        List<Operation> ops = new ArrayList<>();
        ops.add(Operation.put(new Bin("ruleId", ruleId)));
        ops.add(Operation.put(new Bin("testId", variant.testId())));
        ops.add(Operation.put(new Bin("variantId", variant.variantId())));
        ops.add(Operation.add(new Bin("samples", 1L)));
        ops.add(Operation.add(new Bin("impressions", impressions)));
        ops.add(Operation.add(new Bin("conversions", conversions)));
        if (engagement != null) {
            ops.add(Operation.add(new Bin("engCount", 1L)));
            ops.add(Operation.add(new Bin("engSum", engagement)));
            ops.add(Operation.add(new Bin("engSumSq", engagement * engagement)));
        }
        client.operate(writePolicy, key(ruleId, variant), ops.toArray(new Operation[0]));
    }

    public List<OutcomeMetric> findByRule(String ruleId) {
        List<OutcomeMetric> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_VARIANT_OUTCOMES,
                (key, record) -> {
                    try {
                        if (!ruleId.equals(record.getString("ruleId"))) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read outcome metric record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Key key(String ruleId, VariantKey variant) {
        return new Key(namespace, AerospikeConfig.SET_VARIANT_OUTCOMES,
                ruleId + "|" + variant.testId() + "|" + variant.variantId());
    }

    private OutcomeMetric mapRecord(Record record) {
        return OutcomeMetric.builder()
                .ruleId(record.getString("ruleId"))
                .testId(record.getString("testId"))
                .variantId(record.getString("variantId"))
                .samples(record.getLong("samples"))
                .impressions(record.getLong("impressions"))
                .conversions(record.getLong("conversions"))
                .engagementCount(record.getLong("engCount"))
                .engagementSum(record.getDouble("engSum"))
                .engagementSumSquares(record.getDouble("engSumSq"))
                .build();
    }
}
