package com.tokengate.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.tokengate.config.AerospikeConfig;
import com.tokengate.model.WhitelistEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class WhitelistRepository {

    private static final Logger log = LoggerFactory.getLogger(WhitelistRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public WhitelistRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(WhitelistEntry entry) {
        Key key = new Key(namespace, AerospikeConfig.SET_WHITELIST, entry.getGroupId());

        client.put(writePolicy, key,
                new Bin("groupId", entry.getGroupId()),
                new Bin("whitelisted", entry.isWhitelisted()),
                new Bin("approvedAt", entry.getApprovedAt()));
    }

    public WhitelistEntry findByGroupId(String groupId) {
        Key key = new Key(namespace, AerospikeConfig.SET_WHITELIST, groupId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public boolean isWhitelisted(String groupId) {
        WhitelistEntry entry = findByGroupId(groupId);
        return entry != null && entry.isWhitelisted();
    }

    public List<WhitelistEntry> findAllWhitelisted() {
        List<WhitelistEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_WHITELIST,
                (key, record) -> {
                    try {
                        WhitelistEntry entry = mapRecord(record);
                        if (entry.isWhitelisted()) {
                            synchronized (results) {
                                results.add(entry);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read whitelist record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(WhitelistEntry::getApprovedAt));
        return results;
    }

    private WhitelistEntry mapRecord(Record record) {
        return WhitelistEntry.builder()
                .groupId(record.getString("groupId"))
                .whitelisted(record.getBoolean("whitelisted"))
                .approvedAt(record.getLong("approvedAt"))
                .build();
    }
}
