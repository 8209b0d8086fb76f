package com.social.automation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.social.automation.config.AerospikeConfig;
import com.social.automation.model.ScopeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class ScopeRepository {

    private static final Logger log = LoggerFactory.getLogger(ScopeRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public ScopeRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                           @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(ScopeState scope) {
        client.put(writePolicy, key(scope.getScopeId()),
                new Bin("scopeId", scope.getScopeId()),
                new Bin("ownerAuthorId", scope.getOwnerAuthorId()),
                new Bin("pollEnabled", scope.isPollingEnabled()),
                new Bin("pollInterval", scope.getPollIntervalMinutes()),
                new Bin("lastPolledAt", scope.getLastPolledAt()));
    }

    public ScopeState findById(String scopeId) {
        Record record = client.get(readPolicy, key(scopeId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<ScopeState> findAll() {
        List<ScopeState> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_SCOPES,
                (key, record) -> {
                    try {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read scope record: {}", e.getMessage());
                    }
                });
        results.sort(Comparator.comparing(ScopeState::getScopeId));
        return results;
    }

    public List<ScopeState> findPollingEnabled() {
        return findAll().stream()
                .filter(ScopeState::isPollingEnabled)
                .toList();
    }

    /**
     * Stamp a completed poll. Only touches an existing scope record.
     */
    public void updateLastPolledAt(String scopeId, long polledAt) {
        WritePolicy updateOnly = new WritePolicy(writePolicy);
        updateOnly.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        client.put(updateOnly, key(scopeId), new Bin("lastPolledAt", polledAt));
    }

    private Key key(String scopeId) {
        return new Key(namespace, AerospikeConfig.SET_SCOPES, scopeId);
    }

    private ScopeState mapRecord(Record record) {
        return ScopeState.builder()
                .scopeId(record.getString("scopeId"))
                .ownerAuthorId(record.getString("ownerAuthorId"))
                .pollingEnabled(record.getBoolean("pollEnabled"))
                .pollIntervalMinutes(record.getInt("pollInterval"))
                .lastPolledAt(record.getLong("lastPolledAt"))
                .build();
    }
}
