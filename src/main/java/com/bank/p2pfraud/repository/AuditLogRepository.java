package com.bank.p2pfraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.p2pfraud.config.AerospikeConfig;
import com.bank.p2pfraud.model.AuditLogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class AuditLogRepository {

    private static final Logger log = LoggerFactory.getLogger(AuditLogRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public AuditLogRepository(AerospikeClient client,
                              @Qualifier("aerospikeNamespace") String namespace,
                              @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    /**
     * Write-once. Replace is used rather than create-only so that a retried
     * write of the same entry id is harmless.
     */
    public void append(AuditLogEntry entry) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.REPLACE;

        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT_LOGS, entry.getEntryId());
        client.put(policy, key,
                new Bin("entryId", entry.getEntryId()),
                new Bin("actorId", entry.getActorId() != null ? entry.getActorId() : ""),
                new Bin("action", entry.getAction()),
                new Bin("entityType", entry.getEntityType()),
                new Bin("entityId", entry.getEntityId()),
                new Bin("details", entry.getDetails() != null ? entry.getDetails() : ""),
                new Bin("createdAt", entry.getCreatedAt()));
    }

    public List<AuditLogEntry> findRecent(String entityType, String entityId, int limit) {
        List<AuditLogEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_LOGS,
                (key, record) -> {
                    try {
                        if (entityType != null && !entityType.equalsIgnoreCase(record.getString("entityType"))) return;
                        if (entityId != null && !entityId.equals(record.getString("entityId"))) return;
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read audit record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(AuditLogEntry::getCreatedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private AuditLogEntry mapRecord(Record record) {
        String actor = record.getString("actorId");
        return AuditLogEntry.builder()
                .entryId(record.getString("entryId"))
                .actorId(actor != null && !actor.isEmpty() ? actor : null)
                .action(record.getString("action"))
                .entityType(record.getString("entityType"))
                .entityId(record.getString("entityId"))
                .details(record.getString("details"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
