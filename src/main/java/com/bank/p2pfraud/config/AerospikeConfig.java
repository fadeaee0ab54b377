package com.bank.p2pfraud.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Aerospike client and default policies. Multi-record transactions need the
 * namespace to run in strong-consistency mode.
 */
@Configuration
@Profile("!test")
public class AerospikeConfig {

    public static final String SET_ACCOUNTS = "accounts";
    public static final String SET_TRANSACTIONS = "transactions";
    public static final String SET_CASES = "cases";
    public static final String SET_CASE_BY_TXN = "case_by_txn";
    public static final String SET_SETTINGS = "settings";
    public static final String SET_AUDIT_LOGS = "audit_logs";

    @Value("${aerospike.host:127.0.0.1}")
    private String host;

    @Value("${aerospike.port:3000}")
    private int port;

    @Value("${aerospike.namespace:payments}")
    private String namespace;

    @Bean
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.maxConnsPerNode = 300;
        clientPolicy.timeout = 5000;

        // Read policy defaults
        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        // Write policy defaults
        clientPolicy.writePolicyDefault.totalTimeout = 3000;
        clientPolicy.writePolicyDefault.socketTimeout = 1000;

        // Commit verification and roll-forward / roll-back of multi-record transactions
        clientPolicy.txnVerifyPolicyDefault.totalTimeout = 5000;
        clientPolicy.txnRollPolicyDefault.totalTimeout = 5000;

        return new AerospikeClient(clientPolicy, host, port);
    }

    @Bean
    public WritePolicy defaultWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        // strong-consistency namespaces reject non-durable deletes
        policy.durableDelete = true;
        return policy;
    }

    @Bean
    public Policy defaultReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }
}
