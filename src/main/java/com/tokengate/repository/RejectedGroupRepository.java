package com.tokengate.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.tokengate.config.AerospikeConfig;
import com.tokengate.model.RejectedGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Strike records. No delete: a block, once set, is permanent.
 */
@Repository
public class RejectedGroupRepository {

    private static final Logger log = LoggerFactory.getLogger(RejectedGroupRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public RejectedGroupRepository(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                   @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(RejectedGroup group) {
        Key key = new Key(namespace, AerospikeConfig.SET_REJECTED_GROUPS, group.getGroupId());

        client.put(writePolicy, key,
                new Bin("groupId", group.getGroupId()),
                new Bin("rejections", group.getRejectionCount()),
                new Bin("groupName", group.getGroupName() != null ? group.getGroupName() : ""),
                new Bin("lastAdminId", group.getLastAdminId() != null ? group.getLastAdminId() : ""),
                new Bin("firstRejAt", group.getFirstRejectedAt()),
                new Bin("lastRejAt", group.getLastRejectedAt()),
                new Bin("blocked", group.isBlocked()));
    }

    public RejectedGroup findByGroupId(String groupId) {
        Key key = new Key(namespace, AerospikeConfig.SET_REJECTED_GROUPS, groupId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public boolean isBlocked(String groupId) {
        RejectedGroup group = findByGroupId(groupId);
        return group != null && group.isBlocked();
    }

    /**
     * Every group with at least one strike, most recently rejected first.
     */
    public List<RejectedGroup> findAll() {
        List<RejectedGroup> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_REJECTED_GROUPS,
                (key, record) -> {
                    try {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read rejected group record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(RejectedGroup::getLastRejectedAt).reversed());
        return results;
    }

    public List<RejectedGroup> findBlocked() {
        return findAll().stream()
                .filter(RejectedGroup::isBlocked)
                .toList();
    }

    private RejectedGroup mapRecord(Record record) {
        return RejectedGroup.builder()
                .groupId(record.getString("groupId"))
                .rejectionCount(record.getInt("rejections"))
                .groupName(record.getString("groupName"))
                .lastAdminId(record.getString("lastAdminId"))
                .firstRejectedAt(record.getLong("firstRejAt"))
                .lastRejectedAt(record.getLong("lastRejAt"))
                .blocked(record.getBoolean("blocked"))
                .build();
    }
}
