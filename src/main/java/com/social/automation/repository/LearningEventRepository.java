package com.social.automation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.policy.WritePolicy;
import com.social.automation.config.AerospikeConfig;
import com.social.automation.model.LearningEvent;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class LearningEventRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public LearningEventRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    public void save(LearningEvent event) {
        String recordKey = event.getApprovalId() + "_" + event.getEventType();
        Key key = new Key(namespace, AerospikeConfig.SET_LEARNING_EVENTS, recordKey);

        client.put(writePolicy, key,
                new Bin("eventType", event.getEventType()),
                new Bin("approvalId", event.getApprovalId()),
                new Bin("scopeId", event.getScopeId()),
                new Bin("ruleId", event.getRuleId()),
                new Bin("variantKey", event.getVariantKey()),
                new Bin("priority", event.getPriority()),
                new Bin("actor", event.getActor()),
                new Bin("reason", event.getReason()),
                new Bin("createdAt", event.getCreatedAt()));
    }
}
