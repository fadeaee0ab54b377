package com.bank.p2pfraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.Txn;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.p2pfraud.config.AerospikeConfig;
import com.bank.p2pfraud.model.Account;
import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.AccountStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class AccountRepository {

    private static final Logger log = LoggerFactory.getLogger(AccountRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AccountRepository(AerospikeClient client,
                             @Qualifier("aerospikeNamespace") String namespace,
                             @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                             @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * Insert a new account.
     * @return false if an account with the same id already exists
     */
    public boolean create(Account account) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(policy, key(account.getAccountId()), toBins(account));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    public void save(Account account) {
        client.put(writePolicy, key(account.getAccountId()), toBins(account));
    }

    public Account findById(String accountId) {
        return findById(accountId, null);
    }

    public Account findById(String accountId, Txn txn) {
        if (accountId == null) return null;
        Policy policy = new Policy(readPolicy);
        policy.txn = txn;
        Record record = client.get(policy, key(accountId));
        if (record == null) return null;
        return mapRecord(record);
    }

    public Account findByEmail(String email) {
        if (email == null) return null;
        List<Account> matches = scan(record -> email.equalsIgnoreCase(record.getString("email")));
        return matches.isEmpty() ? null : matches.get(0);
    }

    public List<Account> findByRole(AccountRole role) {
        return scan(record -> role.name().equals(record.getString("role")));
    }

    public List<Account> findByStatus(AccountStatus status) {
        return scan(record -> status.name().equals(record.getString("status")));
    }

    public void updateBalance(String accountId, double newBalance, Txn txn) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.txn = txn;
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        client.put(policy, key(accountId), new Bin("balance", newBalance));
    }

    public void updateStatus(String accountId, AccountStatus status, double balance) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        client.put(policy, key(accountId),
                new Bin("status", status.name()),
                new Bin("balance", balance));
    }

    private List<Account> scan(java.util.function.Predicate<Record> filter) {
        List<Account> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ACCOUNTS,
                (key, record) -> {
                    try {
                        if (filter.test(record)) {
                            synchronized (results) {
                                results.add(mapRecord(record));
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read account record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Account::getCreatedAt));
        return results;
    }

    private Key key(String accountId) {
        return new Key(namespace, AerospikeConfig.SET_ACCOUNTS, accountId);
    }

    private Bin[] toBins(Account account) {
        return new Bin[] {
                new Bin("accountId", account.getAccountId()),
                new Bin("name", account.getName()),
                new Bin("email", account.getEmail()),
                new Bin("role", account.getRole().name()),
                new Bin("status", account.getStatus().name()),
                new Bin("balance", account.getBalance()),
                new Bin("createdAt", account.getCreatedAt())
        };
    }

    private Account mapRecord(Record record) {
        return Account.builder()
                .accountId(record.getString("accountId"))
                .name(record.getString("name"))
                .email(record.getString("email"))
                .role(AccountRole.valueOf(record.getString("role")))
                .status(AccountStatus.valueOf(record.getString("status")))
                .balance(record.getDouble("balance"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }
}
