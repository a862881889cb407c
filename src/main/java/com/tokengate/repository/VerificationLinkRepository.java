package com.tokengate.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.tokengate.config.AerospikeConfig;
import com.tokengate.model.VerificationLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Verification links are keyed by their token. Links are never deleted, so a group that was set up
 * more than once has several valid links; the newest one is the one shown to admins.
 */
@Repository
public class VerificationLinkRepository {

    private static final Logger log = LoggerFactory.getLogger(VerificationLinkRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public VerificationLinkRepository(AerospikeClient client,
                                      @Qualifier("aerospikeNamespace") String namespace,
                                      @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                      @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(VerificationLink link) {
        Key key = new Key(namespace, AerospikeConfig.SET_VERIFICATION_LINKS, link.getToken());

        client.put(writePolicy, key,
                new Bin("token", link.getToken()),
                new Bin("groupId", link.getGroupId()),
                new Bin("createdAt", link.getCreatedAt()));
    }

    public VerificationLink findByToken(String token) {
        Key key = new Key(namespace, AerospikeConfig.SET_VERIFICATION_LINKS, token);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public VerificationLink findLatestByGroupId(String groupId) {
        AtomicReference<VerificationLink> latest = new AtomicReference<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_VERIFICATION_LINKS,
                (key, record) -> {
                    try {
                        if (!groupId.equals(record.getString("groupId"))) return;
                        VerificationLink link = mapRecord(record);
                        latest.accumulateAndGet(link, (current, candidate) ->
                                current == null || candidate.getCreatedAt() > current.getCreatedAt()
                                        ? candidate : current);
                    } catch (Exception e) {
                        log.warn("Failed to read verification link record: {}", e.getMessage());
                    }
                });
        return latest.get();
    }

    private VerificationLink mapRecord(Record record) {
        return VerificationLink.builder()
                .token(record.getString("token"))
                .groupId(record.getString("groupId"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
