package com.tokengate.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.tokengate.config.AerospikeConfig;
import com.tokengate.model.InviteRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

@Repository
public class InviteRepository {

    private static final Logger log = LoggerFactory.getLogger(InviteRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public InviteRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(InviteRecord invite) {
        Key key = key(invite.getGroupId(), invite.getUserId());

        client.put(writePolicy, key,
                new Bin("groupId", invite.getGroupId()),
                new Bin("userId", invite.getUserId()),
                new Bin("link", invite.getInviteLink()),
                new Bin("issuedAt", invite.getIssuedAt()),
                new Bin("expiresAt", invite.getExpiresAt()));
    }

    public InviteRecord find(String groupId, String userId) {
        Record record = client.get(readPolicy, key(groupId, userId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public boolean delete(String groupId, String userId) {
        return client.delete(writePolicy, key(groupId, userId));
    }

    public List<InviteRecord> findExpired(long now) {
        List<InviteRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_INVITES,
                (key, record) -> {
                    try {
                        InviteRecord invite = mapRecord(record);
                        if (invite.isExpired(now)) {
                            synchronized (results) {
                                results.add(invite);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read invite record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private Key key(String groupId, String userId) {
        return new Key(namespace, AerospikeConfig.SET_INVITES, groupId + ":" + userId);
    }

    private InviteRecord mapRecord(Record record) {
        return InviteRecord.builder()
                .groupId(record.getString("groupId"))
                .userId(record.getString("userId"))
                .inviteLink(record.getString("link"))
                .issuedAt(record.getLong("issuedAt"))
                .expiresAt(record.getLong("expiresAt"))
                .build();
    }
}
