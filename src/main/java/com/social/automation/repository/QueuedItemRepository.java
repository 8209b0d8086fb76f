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
import com.social.automation.model.ItemStatus;
import com.social.automation.model.QueuedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class QueuedItemRepository {

    private static final Logger log = LoggerFactory.getLogger(QueuedItemRepository.class);

    /** Strict processing order within a scope: priority desc, then oldest first. */
    public static final Comparator<QueuedItem> PROCESSING_ORDER =
            Comparator.comparingInt(QueuedItem::getPriority).reversed()
                    .thenComparingLong(QueuedItem::getCreatedAt)
                    .thenComparing(QueuedItem::getItemId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public QueuedItemRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Insert the item unless a record with the same external id already exists.
     * @return true if inserted, false if the item was already queued
     */
    public boolean insertIfAbsent(QueuedItem item) {
        Key key = key(item.getItemId());
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        try {
            client.put(createOnly, key, toBins(item));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                log.trace("Item {} already queued", item.getItemId());
                return false;
            }
            throw e;
        }
    }

    public QueuedItem findById(String itemId) {
        Record record = client.get(readPolicy, key(itemId));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Pending items of one scope in processing order, at most {@code limit}.
     */
    public List<QueuedItem> findPendingByScope(String scopeId, int limit) {
        List<QueuedItem> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_QUEUED_ITEMS,
                (key, record) -> {
                    try {
                        if (!scopeId.equals(record.getString("scopeId"))) return;
                        if (!ItemStatus.PENDING.name().equals(record.getString("status"))) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read queued item record: {}", e.getMessage());
                    }
                });

        results.sort(PROCESSING_ORDER);
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    /**
     * Move an item from {@code expected} to {@code target} status. The write is guarded by the
     * record generation, so a concurrent writer makes this call lose rather than overwrite.
     * @return true if this caller performed the transition
     */
    public boolean transitionStatus(String itemId, ItemStatus expected, ItemStatus target) {
        Key key = key(itemId);
        Record record = client.get(readPolicy, key);
        if (record == null) return false;

        String current = record.getString("status");
        if (!expected.name().equals(current)) {
            log.debug("Item {} is {} (expected {}), skipping transition to {}", itemId, current, expected, target);
            return false;
        }
        if (ItemStatus.DONE.name().equals(current)) {
            return false;
        }

        WritePolicy casPolicy = AerospikeConfig.casPolicy(writePolicy, record.generation);

        try {
            client.put(casPolicy, key,
                    new Bin("status", target.name()),
                    new Bin("updatedAt", System.currentTimeMillis()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Lost status race on item {} ({} -> {})", itemId, expected, target);
                return false;
            }
            throw e;
        }
    }

    private Key key(String itemId) {
        return new Key(namespace, AerospikeConfig.SET_QUEUED_ITEMS, itemId);
    }

    private Bin[] toBins(QueuedItem item) {
        return new Bin[]{
                new Bin("itemId", item.getItemId()),
                new Bin("scopeId", item.getScopeId()),
                new Bin("contentId", item.getContentId()),
                new Bin("text", item.getText()),
                new Bin("classification", item.getClassification()),
                new Bin("authorId", item.getAuthorId()),
                new Bin("authorStatus", item.getAuthorStatus()),
                new Bin("status", item.getStatus().name()),
                new Bin("priority", item.getPriority()),
                new Bin("createdAt", item.getCreatedAt()),
                new Bin("updatedAt", item.getUpdatedAt())
        };
    }

    private QueuedItem mapRecord(Record record) {
        return QueuedItem.builder()
                .itemId(record.getString("itemId"))
                .scopeId(record.getString("scopeId"))
                .contentId(record.getString("contentId"))
                .text(record.getString("text"))
                .classification(record.getString("classification"))
                .authorId(record.getString("authorId"))
                .authorStatus(record.getString("authorStatus"))
                .status(ItemStatus.valueOf(record.getString("status")))
                .priority(record.getInt("priority"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
