package com.tokengate.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.tokengate.config.AerospikeConfig;
import com.tokengate.model.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Durable verification state of group members, keyed by {@code groupId:userId}.
 * Callers serialize writes per member through the member's key lock.
 */
@Repository
public class UserRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(UserRecordRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public UserRecordRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(UserRecord userRecord) {
        Key key = key(userRecord.getGroupId(), userRecord.getUserId());

        client.put(writePolicy, key,
                new Bin("groupId", userRecord.getGroupId()),
                new Bin("userId", userRecord.getUserId()),
                new Bin("address", userRecord.getAddress()),
                new Bin("verified", userRecord.isVerified()),
                new Bin("lastVerifiedAt", userRecord.getLastVerifiedAt()),
                new Bin("txConfirmed", userRecord.isVerificationTxConfirmed()),
                new Bin("evictPending", userRecord.isEvictionPending()));
    }

    public UserRecord find(String groupId, String userId) {
        Record record = client.get(readPolicy, key(groupId, userId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public boolean delete(String groupId, String userId) {
        return client.delete(writePolicy, key(groupId, userId));
    }

    public List<UserRecord> findByGroupId(String groupId) {
        List<UserRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_USER_RECORDS,
                (key, record) -> {
                    try {
                        if (!groupId.equals(record.getString("groupId"))) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read user record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparing(UserRecord::getUserId));
        return results;
    }

    public List<UserRecord> findVerifiedByGroupId(String groupId) {
        return findByGroupId(groupId).stream()
                .filter(UserRecord::isVerified)
                .toList();
    }

    /**
     * Members whose balance fell short but whose removal from the group has not succeeded yet.
     */
    public List<UserRecord> findPendingEvictionByGroupId(String groupId) {
        return findByGroupId(groupId).stream()
                .filter(UserRecord::isEvictionPending)
                .toList();
    }

    private Key key(String groupId, String userId) {
        return new Key(namespace, AerospikeConfig.SET_USER_RECORDS, groupId + ":" + userId);
    }

    private UserRecord mapRecord(Record record) {
        return UserRecord.builder()
                .groupId(record.getString("groupId"))
                .userId(record.getString("userId"))
                .address(record.getString("address"))
                .verified(record.getBoolean("verified"))
                .lastVerifiedAt(record.getLong("lastVerifiedAt"))
                .verificationTxConfirmed(record.getBoolean("txConfirmed"))
                .evictionPending(record.getBoolean("evictPending"))
                .build();
    }
}
