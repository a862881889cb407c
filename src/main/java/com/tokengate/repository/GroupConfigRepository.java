package com.tokengate.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.tokengate.config.AerospikeConfig;
import com.tokengate.model.GroupConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class GroupConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(GroupConfigRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public GroupConfigRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(GroupConfig config) {
        Key key = new Key(namespace, AerospikeConfig.SET_GROUP_CONFIGS, config.getGroupId());

        client.put(writePolicy, key,
                new Bin("groupId", config.getGroupId()),
                new Bin("chainId", config.getChainId()),
                new Bin("tokenAddress", config.getTokenAddress()),
                new Bin("minBalance", config.getMinBalance().toPlainString()),
                new Bin("verifier", config.getVerifierAddress()),
                new Bin("configuredBy", config.getConfiguredBy() != null ? config.getConfiguredBy() : ""),
                new Bin("updatedAt", config.getUpdatedAt()));
    }

    public GroupConfig findByGroupId(String groupId) {
        Key key = new Key(namespace, AerospikeConfig.SET_GROUP_CONFIGS, groupId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * All configured groups, ordered by group id so sweeps visit them in a stable order.
     */
    public List<GroupConfig> findAll() {
        List<GroupConfig> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_GROUP_CONFIGS,
                (key, record) -> {
                    try {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read group config record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(GroupConfig::getGroupId));
        return results;
    }

    public boolean delete(String groupId) {
        Key key = new Key(namespace, AerospikeConfig.SET_GROUP_CONFIGS, groupId);
        return client.delete(writePolicy, key);
    }

    private GroupConfig mapRecord(Record record) {
        String configuredBy = record.getString("configuredBy");
        return GroupConfig.builder()
                .groupId(record.getString("groupId"))
                .chainId(record.getString("chainId"))
                .tokenAddress(record.getString("tokenAddress"))
                .minBalance(new BigDecimal(record.getString("minBalance")))
                .verifierAddress(record.getString("verifier"))
                .configuredBy(configuredBy == null || configuredBy.isEmpty() ? null : configuredBy)
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
