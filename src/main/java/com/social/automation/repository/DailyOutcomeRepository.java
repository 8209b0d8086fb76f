package com.social.automation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.social.automation.config.AerospikeConfig;
import com.social.automation.model.DailyRuleOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Day-bucketed counters per rule, split by automated and manual responses.
 */
@Repository
public class DailyOutcomeRepository {

    private static final Logger log = LoggerFactory.getLogger(DailyOutcomeRepository.class);
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public DailyOutcomeRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void recordResponse(String ruleId, LocalDate day, boolean automated) {
        List<Operation> ops = new ArrayList<>(List.of(identity(ruleId, day, automated)));
        ops.add(Operation.add(new Bin("responses", 1L)));
        client.operate(writePolicy, key(ruleId, day, automated), ops.toArray(new Operation[0]));
    }

    public void recordFeedback(String ruleId, LocalDate day, boolean automated,
                               long impressions, long conversions, Double engagement) {
        List<Operation> ops = new ArrayList<>(List.of(identity(ruleId, day, automated)));
        ops.add(Operation.add(new Bin("impressions", impressions)));
        ops.add(Operation.add(new Bin("conversions", conversions)));
        if (engagement != null) {
            ops.add(Operation.add(new Bin("engCount", 1L)));
            ops.add(Operation.add(new Bin("engSum", engagement)));
        }
        client.operate(writePolicy, key(ruleId, day, automated), ops.toArray(new Operation[0]));
    }

    /**
     * Buckets from {@code fromDay} (inclusive) onwards, optionally for a single rule, ordered by day.
     */
    public List<DailyRuleOutcome> findSince(String ruleId, LocalDate fromDay) {
        int fromKey = Integer.parseInt(fromDay.format(DAY_FORMAT));
        List<DailyRuleOutcome> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DAILY_OUTCOMES,
                (key, record) -> {
                    try {
                        if (ruleId != null && !ruleId.equals(record.getString("ruleId"))) return;
                        if (record.getInt("day") < fromKey) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read daily outcome record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(DailyRuleOutcome::getDay)
                .thenComparing(DailyRuleOutcome::getRuleId));
        return results;
    }

    private Operation[] identity(String ruleId, LocalDate day, boolean automated) {
        return new Operation[]{
                Operation.put(new Bin("ruleId", ruleId)),
                Operation.put(new Bin("day", Integer.parseInt(day.format(DAY_FORMAT)))),
                Operation.put(new Bin("automated", automated))
        };
    }

    private Key key(String ruleId, LocalDate day, boolean automated) {
        return new Key(namespace, AerospikeConfig.SET_DAILY_OUTCOMES,
                ruleId + "|" + day.format(DAY_FORMAT) + "|" + (automated ? "auto" : "manual"));
    }

    private DailyRuleOutcome mapRecord(Record record) {
        return DailyRuleOutcome.builder()
                .ruleId(record.getString("ruleId"))
                .day(LocalDate.parse(String.valueOf(record.getInt("day")), DAY_FORMAT))
                .automated(record.getBoolean("automated"))
                .responses(record.getLong("responses"))
                .impressions(record.getLong("impressions"))
                .conversions(record.getLong("conversions"))
                .engagementCount(record.getLong("engCount"))
                .engagementSum(record.getDouble("engSum"))
                .build();
    }
}
