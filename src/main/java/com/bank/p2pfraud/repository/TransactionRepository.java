package com.bank.p2pfraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.Txn;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.p2pfraud.config.AerospikeConfig;
import com.bank.p2pfraud.exception.CorruptRecordException;
import com.bank.p2pfraud.model.PagedResponse;
import com.bank.p2pfraud.model.Transaction;
import com.bank.p2pfraud.model.TransactionDetails;
import com.bank.p2pfraud.model.TransactionStatus;
import com.bank.p2pfraud.model.TransactionType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

@Repository
public class TransactionRepository {

    private static final Logger log = LoggerFactory.getLogger(TransactionRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public TransactionRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy,
                                 @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(Transaction txn, Txn unitOfWork) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.txn = unitOfWork;
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("txnId", txn.getTxnId()),
                new Bin("type", txn.getType().name()),
                new Bin("senderId", txn.getSenderId()),
                new Bin("amount", txn.getAmount()),
                new Bin("currency", txn.getCurrency()),
                new Bin("status", txn.getStatus().name()),
                new Bin("details", serializeDetails(txn.getDetails())),
                new Bin("createdAt", txn.getCreatedAt())));

        if (txn.getRecipientId() != null) {
            bins.add(new Bin("recipientId", txn.getRecipientId()));
        }
        if (txn.getDescription() != null) {
            bins.add(new Bin("description", txn.getDescription()));
        }
        if (txn.getIpAddress() != null) {
            bins.add(new Bin("ipAddress", txn.getIpAddress()));
        }
        if (txn.getDeviceSignature() != null) {
            bins.add(new Bin("deviceSig", txn.getDeviceSignature()));
        }
        if (txn.getLocation() != null) {
            bins.add(new Bin("location", txn.getLocation()));
        }
        if (txn.getRiskScore() != null) {
            bins.add(new Bin("riskScore", txn.getRiskScore()));
        }

        client.put(policy, key(txn.getTxnId()), bins.toArray(new Bin[0]));
    }

    /**
     * Read for display. Unreadable details come back empty.
     */
    public Transaction findById(String txnId) {
        Record record = client.get(readPolicy, key(txnId));
        if (record == null) return null;
        return mapRecord(record, false);
    }

    /**
     * Read inside a unit of work that may write the record back.
     *
     * @throws CorruptRecordException if the details bin cannot be read
     */
    public Transaction findById(String txnId, Txn unitOfWork) {
        Policy policy = new Policy(readPolicy);
        policy.txn = unitOfWork;
        Record record = client.get(policy, key(txnId));
        if (record == null) return null;
        return mapRecord(record, true);
    }

    /**
     * Only the mutable part of a transaction: status and details. Amount,
     * parties and captured context are never rewritten.
     */
    public void updateStatus(String txnId, TransactionStatus status, TransactionDetails details, Txn unitOfWork) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.txn = unitOfWork;
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        client.put(policy, key(txnId),
                new Bin("status", status.name()),
                new Bin("details", serializeDetails(details)));
    }

    public List<Transaction> findBySenderSince(String senderId, long sinceMillis) {
        return scan(record -> senderId.equals(record.getString("senderId"))
                && record.getLong("createdAt") >= sinceMillis);
    }

    public List<Transaction> findRecentBySender(String senderId, int limit) {
        List<Transaction> all = scan(record -> senderId.equals(record.getString("senderId")));
        return all.size() > limit ? new ArrayList<>(all.subList(0, limit)) : all;
    }

    public boolean existsBySenderAndRecipient(String senderId, String recipientId, long beforeMillis) {
        if (recipientId == null) return false;
        return !scan(record -> senderId.equals(record.getString("senderId"))
                && recipientId.equals(record.getString("recipientId"))
                && record.getLong("createdAt") < beforeMillis).isEmpty();
    }

    public long countBySenderAndStatuses(String senderId, List<TransactionStatus> statuses, String excludeTxnId) {
        List<String> names = statuses.stream().map(Enum::name).toList();
        return scan(record -> senderId.equals(record.getString("senderId"))
                && names.contains(record.getString("status"))
                && !record.getString("txnId").equals(excludeTxnId)).size();
    }

    public PagedResponse<Transaction> findByStatus(TransactionStatus status, int limit, Long before) {
        return page(scan(record -> status.name().equals(record.getString("status"))
                && (before == null || record.getLong("createdAt") < before)), limit);
    }

    public PagedResponse<Transaction> findBySender(String senderId, int limit, Long before) {
        return page(scan(record -> senderId.equals(record.getString("senderId"))
                && (before == null || record.getLong("createdAt") < before)), limit);
    }

    // newest first
    private List<Transaction> scan(Predicate<Record> filter) {
        List<Transaction> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TRANSACTIONS,
                (key, record) -> {
                    try {
                        if (filter.test(record)) {
                            synchronized (results) {
                                results.add(mapRecord(record, false));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read transaction record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Transaction::getCreatedAt).reversed());
        return results;
    }

    private PagedResponse<Transaction> page(List<Transaction> results, int limit) {
        boolean hasMore = results.size() > limit;
        List<Transaction> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = hasMore ? String.valueOf(page.get(page.size() - 1).getCreatedAt()) : null;
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    private Key key(String txnId) {
        return new Key(namespace, AerospikeConfig.SET_TRANSACTIONS, txnId);
    }

    private Transaction mapRecord(Record record, boolean strictDetails) {
        String txnId = record.getString("txnId");
        String type = record.getString("type");
        return Transaction.builder()
                .txnId(txnId)
                .type(type != null ? TransactionType.valueOf(type) : TransactionType.PAYMENT)
                .senderId(record.getString("senderId"))
                .recipientId(record.getString("recipientId"))
                .amount(record.getDouble("amount"))
                .currency(record.getString("currency"))
                .description(record.getString("description"))
                .ipAddress(record.getString("ipAddress"))
                .deviceSignature(record.getString("deviceSig"))
                .location(record.getString("location"))
                .status(TransactionStatus.valueOf(record.getString("status")))
                .riskScore(record.getValue("riskScore") != null ? record.getDouble("riskScore") : null)
                .details(deserializeDetails(txnId, record.getString("details"), strictDetails))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    private String serializeDetails(TransactionDetails details) {
        try {
            return objectMapper.writeValueAsString(details != null ? details : TransactionDetails.builder().build());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize transaction details", e);
        }
    }

    private TransactionDetails deserializeDetails(String txnId, String json, boolean strict) {
        if (json == null || json.isEmpty()) return TransactionDetails.builder().build();
        try {
            return objectMapper.readValue(json, TransactionDetails.class);
        } catch (JsonProcessingException e) {
            if (strict) {
                throw new CorruptRecordException("Details of transaction " + txnId + " are unreadable", e);
            }
            log.error("Failed to deserialize details of transaction {}", txnId, e);
            return TransactionDetails.builder().build();
        }
    }
}
