package com.tokengate.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.tokengate.config.AerospikeConfig;
import com.tokengate.model.PendingWhitelistRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class PendingWhitelistRepository {

    private static final Logger log = LoggerFactory.getLogger(PendingWhitelistRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public PendingWhitelistRepository(AerospikeClient client,
                                      @Qualifier("aerospikeNamespace") String namespace,
                                      @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                      @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(PendingWhitelistRequest request) {
        Key key = new Key(namespace, AerospikeConfig.SET_PENDING_WHITELIST, request.getGroupId());

        client.put(writePolicy, key,
                new Bin("groupId", request.getGroupId()),
                new Bin("groupName", request.getGroupName() != null ? request.getGroupName() : ""),
                new Bin("adminId", request.getRequestingAdminId()),
                new Bin("requestedAt", request.getRequestedAt()));
    }

    public PendingWhitelistRequest findByGroupId(String groupId) {
        Key key = new Key(namespace, AerospikeConfig.SET_PENDING_WHITELIST, groupId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public boolean delete(String groupId) {
        Key key = new Key(namespace, AerospikeConfig.SET_PENDING_WHITELIST, groupId);
        return client.delete(writePolicy, key);
    }

    /**
     * Pending requests, oldest first.
     */
    public List<PendingWhitelistRequest> findAll() {
        List<PendingWhitelistRequest> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PENDING_WHITELIST,
                (key, record) -> {
                    try {
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read pending whitelist record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(PendingWhitelistRequest::getRequestedAt));
        return results;
    }

    private PendingWhitelistRequest mapRecord(Record record) {
        return PendingWhitelistRequest.builder()
                .groupId(record.getString("groupId"))
                .groupName(record.getString("groupName"))
                .requestingAdminId(record.getString("adminId"))
                .requestedAt(record.getLong("requestedAt"))
                .build();
    }
}
