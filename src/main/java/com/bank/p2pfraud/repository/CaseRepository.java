package com.bank.p2pfraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.Txn;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.p2pfraud.config.AerospikeConfig;
import com.bank.p2pfraud.model.CaseFinding;
import com.bank.p2pfraud.model.CasePriority;
import com.bank.p2pfraud.model.CaseStatus;
import com.bank.p2pfraud.model.InvestigationCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Repository
public class CaseRepository {

    private static final Logger log = LoggerFactory.getLogger(CaseRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public CaseRepository(AerospikeClient client,
                          @Qualifier("aerospikeNamespace") String namespace,
                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                          @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Insert a case and point the transaction index at it, in the caller's unit of work.
     */
    public void create(InvestigationCase c, Txn txn) {
        WritePolicy createPolicy = new WritePolicy(writePolicy);
        createPolicy.txn = txn;
        createPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        client.put(createPolicy, caseKey(c.getCaseId()), toBins(c));

        WritePolicy indexPolicy = new WritePolicy(writePolicy);
        indexPolicy.txn = txn;
        client.put(indexPolicy, indexKey(c.getTxnId()), new Bin("caseId", c.getCaseId()));
    }

    public InvestigationCase findById(String caseId) {
        return findById(caseId, null);
    }

    public InvestigationCase findById(String caseId, Txn txn) {
        Policy policy = new Policy(readPolicy);
        policy.txn = txn;
        Record record = client.get(policy, caseKey(caseId));
        if (record == null) return null;
        return mapRecord(record);
    }

    /** Latest case opened for the transaction, resolved or not. */
    public InvestigationCase findByTransactionId(String txnId, Txn txn) {
        Policy policy = new Policy(readPolicy);
        policy.txn = txn;
        Record index = client.get(policy, indexKey(txnId));
        if (index == null) return null;
        return findById(index.getString("caseId"), txn);
    }

    /**
     * Compare-and-swap update on the generation read with the case.
     * @return false if the case changed since it was read
     */
    public boolean update(InvestigationCase c, Txn txn) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.txn = txn;
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = c.getGeneration();
        try {
            client.put(policy, caseKey(c.getCaseId()), toBins(c));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.debug("Case {} changed concurrently (expected generation {})", c.getCaseId(), c.getGeneration());
                return false;
            }
            throw e;
        }
    }

    public List<InvestigationCase> findByFilters(String assignedTo, CaseStatus status, boolean unassignedOnly) {
        List<InvestigationCase> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CASES,
                (key, record) -> {
                    try {
                        String recAssignee = record.getString("assignedTo");
                        if (unassignedOnly && recAssignee != null) return;
                        if (assignedTo != null && !assignedTo.equals(recAssignee)) return;
                        if (status != null && !status.name().equals(record.getString("status"))) return;

                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to filter case record: {}", e.getMessage());
                    }
                });

        // High priority first, oldest first within a priority
        results.sort(Comparator.comparing(InvestigationCase::getPriority)
                .thenComparingLong(InvestigationCase::getCreatedAt));
        return results;
    }

    /**
     * Get counts by case status for dashboard stats.
     */
    public Map<CaseStatus, Long> countByStatus() {
        Map<CaseStatus, Long> counts = new EnumMap<>(CaseStatus.class);
        for (CaseStatus s : CaseStatus.values()) counts.put(s, 0L);
        scanCount(record -> {
            CaseStatus status = CaseStatus.valueOf(record.getString("status"));
            counts.merge(status, 1L, Long::sum);
        });
        return counts;
    }

    public Map<CaseFinding, Long> countByFinding() {
        Map<CaseFinding, Long> counts = new EnumMap<>(CaseFinding.class);
        for (CaseFinding f : CaseFinding.values()) counts.put(f, 0L);
        scanCount(record -> {
            CaseFinding finding = CaseFinding.valueOf(record.getString("finding"));
            counts.merge(finding, 1L, Long::sum);
        });
        return counts;
    }

    private void scanCount(java.util.function.Consumer<Record> counter) {
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_CASES,
                (key, record) -> {
                    try {
                        synchronized (counter) {
                            counter.accept(record);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to count case record: {}", e.getMessage());
                    }
                });
    }

    private Key caseKey(String caseId) {
        return new Key(namespace, AerospikeConfig.SET_CASES, caseId);
    }

    private Key indexKey(String txnId) {
        return new Key(namespace, AerospikeConfig.SET_CASE_BY_TXN, txnId);
    }

    private Bin[] toBins(InvestigationCase c) {
        return new Bin[] {
                new Bin("caseId", c.getCaseId()),
                new Bin("txnId", c.getTxnId()),
                new Bin("assignedTo", c.getAssignedTo()),
                new Bin("status", c.getStatus().name()),
                new Bin("finding", c.getFinding().name()),
                new Bin("report", c.getReport() != null ? c.getReport() : ""),
                new Bin("confidence", c.getConfidence() != null ? c.getConfidence() : -1),
                new Bin("priority", c.getPriority().name()),
                new Bin("createdAt", c.getCreatedAt()),
                new Bin("updatedAt", c.getUpdatedAt())
        };
    }

    private InvestigationCase mapRecord(Record record) {
        String reportStr = record.getString("report");
        int confidence = record.getValue("confidence") != null ? record.getInt("confidence") : -1;
        return InvestigationCase.builder()
                .caseId(record.getString("caseId"))
                .txnId(record.getString("txnId"))
                .assignedTo(record.getString("assignedTo"))
                .status(CaseStatus.valueOf(record.getString("status")))
                .finding(CaseFinding.valueOf(record.getString("finding")))
                .report(reportStr != null && !reportStr.isEmpty() ? reportStr : null)
                .confidence(confidence >= 0 ? confidence : null)
                .priority(CasePriority.valueOf(record.getString("priority")))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .generation(record.generation)
                .build();
    }
}
