package com.social.automation.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.social.automation.config.AerospikeConfig;
import com.social.automation.model.AutomationRule;
import com.social.automation.model.RuleCondition;
import com.social.automation.model.Variant;
import com.social.automation.model.action.ActionConfig;
import com.social.automation.model.action.RuleDefinitionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

@Repository
public class RuleRepository {

    private static final Logger log = LoggerFactory.getLogger(RuleRepository.class);

    /** Evaluation order across rules of a scope: priority desc, rule id as the stable tie-break. */
    public static final Comparator<AutomationRule> EVALUATION_ORDER =
            Comparator.comparingInt(AutomationRule::getPriority).reversed()
                    .thenComparing(AutomationRule::getRuleId);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    // Snapshot of all valid rules, reloaded at the start of every automation tick and after writes
    private final AtomicReference<List<AutomationRule>> cachedRules = new AtomicReference<>(new CopyOnWriteArrayList<>());

    public RuleRepository(AerospikeClient client,
                          @Qualifier("aerospikeNamespace") String namespace,
                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                          @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void refreshCache() {
        List<AutomationRule> allRules = scanAllRules();
        cachedRules.set(new CopyOnWriteArrayList<>(allRules));
        log.debug("Rule cache refreshed, {} rules loaded", allRules.size());
    }

    /**
     * Enabled rules of a scope in evaluation order, from the in-memory snapshot.
     */
    public List<AutomationRule> getEnabledRules(String scopeId) {
        return cachedRules.get().stream()
                .filter(AutomationRule::isEnabled)
                .filter(r -> scopeId.equals(r.getScopeId()))
                .sorted(EVALUATION_ORDER)
                .toList();
    }

    /**
     * Scopes with at least one enabled rule, from the in-memory snapshot.
     */
    public Set<String> getScopesWithEnabledRules() {
        Set<String> scopes = new TreeSet<>();
        for (AutomationRule rule : cachedRules.get()) {
            if (rule.isEnabled()) {
                scopes.add(rule.getScopeId());
            }
        }
        return scopes;
    }

    public List<AutomationRule> findAll() {
        List<AutomationRule> rules = new ArrayList<>(scanAllRules());
        rules.sort(Comparator.comparing(AutomationRule::getScopeId).thenComparing(EVALUATION_ORDER));
        return rules;
    }

    public AutomationRule findById(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUTOMATION_RULES, ruleId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecordToRule(ruleId, record);
    }

    /**
     * Validate and persist a rule.
     * @throws RuleDefinitionException if the rule is not executable
     */
    public void save(AutomationRule rule) {
        rule.validate();
        Key key = new Key(namespace, AerospikeConfig.SET_AUTOMATION_RULES, rule.getRuleId());

        client.put(writePolicy, key,
                new Bin("ruleId", rule.getRuleId()),
                new Bin("scopeId", rule.getScopeId()),
                new Bin("name", rule.getName()),
                new Bin("priority", rule.getPriority()),
                new Bin("enabled", rule.isEnabled()),
                new Bin("condition", toJson(rule.getCondition())),
                new Bin("action", toJson(rule.getAction())),
                new Bin("responseLimit", rule.getResponseLimitPerRun()),
                new Bin("reqApproval", rule.isRequireApproval()),
                new Bin("abTests", toJson(rule.getAbTests())),
                new Bin("createdAt", rule.getCreatedAt()));

        refreshCache();
    }

    public boolean delete(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUTOMATION_RULES, ruleId);
        boolean deleted = client.delete(writePolicy, key);
        if (deleted) {
            refreshCache();
        }
        return deleted;
    }

    private List<AutomationRule> scanAllRules() {
        List<AutomationRule> rules = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUTOMATION_RULES,
                (key, record) -> {
                    String ruleId = record.getString("ruleId");
                    if (ruleId == null) return;
                    try {
                        AutomationRule rule = mapRecordToRule(ruleId, record);
                        rule.validate();
                        synchronized (rules) {
                            rules.add(rule);
                        }
                    } catch (RuleDefinitionException e) {
                        log.warn("Skipping invalid rule {}: {}", ruleId, e.getMessage());
                    } catch (Exception e) {
                        log.warn("Failed to deserialize rule record {}: {}", ruleId, e.getMessage());
                    }
                });
        return rules;
    }

    private AutomationRule mapRecordToRule(String ruleId, Record record) {
        return AutomationRule.builder()
                .ruleId(ruleId)
                .scopeId(record.getString("scopeId"))
                .name(record.getString("name"))
                .priority(record.getInt("priority"))
                .enabled(record.getBoolean("enabled"))
                .condition(fromJson(record.getString("condition"), new TypeReference<RuleCondition>() {},
                        new RuleCondition()))
                .action(fromJson(record.getString("action"), new TypeReference<ActionConfig>() {}, null))
                .responseLimitPerRun(record.getInt("responseLimit"))
                .requireApproval(record.getBoolean("reqApproval"))
                .abTests(fromJson(record.getString("abTests"),
                        new TypeReference<LinkedHashMap<String, List<Variant>>>() {}, new LinkedHashMap<>()))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new RuleDefinitionException("Rule is not serializable: " + e.getOriginalMessage());
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isEmpty() || "null".equals(json)) return fallback;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new RuleDefinitionException("Malformed rule definition: " + e.getOriginalMessage());
        }
    }
}
