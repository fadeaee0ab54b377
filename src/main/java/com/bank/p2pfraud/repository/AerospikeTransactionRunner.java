package com.bank.p2pfraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Txn;
import com.bank.p2pfraud.exception.LedgerConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Runs a unit of work inside an Aerospike multi-record transaction.
 *
 * <p>Every repository call made with the supplied {@link Txn} is committed or
 * aborted together. A failed commit surfaces as {@link LedgerConflictException}
 * so callers never observe a partially applied ledger change. Requires a
 * strong-consistency namespace on the server.
 */
@Component
public class AerospikeTransactionRunner {

    private static final Logger log = LoggerFactory.getLogger(AerospikeTransactionRunner.class);

    private final AerospikeClient client;

    public AerospikeTransactionRunner(AerospikeClient client) {
        this.client = client;
    }

    public <T> T execute(Function<Txn, T> work) {
        Txn txn = new Txn();
        T result;
        try {
            result = work.apply(txn);
        } catch (AerospikeException e) {
            // includes records locked by a concurrent transaction
            abortQuietly(txn, e);
            throw new LedgerConflictException("Ledger transaction aborted: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            abortQuietly(txn, e);
            throw e;
        }

        try {
            client.commit(txn);
        } catch (AerospikeException.Commit e) {
            // the client has already rolled back or marked the transaction abandoned
            log.error("Commit failed for txn={}: {}", txn.getId(), e.getMessage());
            throw new LedgerConflictException("Ledger transaction could not be committed", e);
        } catch (AerospikeException e) {
            abortQuietly(txn, e);
            throw new LedgerConflictException("Ledger transaction could not be committed", e);
        }
        return result;
    }

    private void abortQuietly(Txn txn, Exception cause) {
        try {
            client.abort(txn);
            log.debug("Aborted txn={} after: {}", txn.getId(), cause.getMessage());
        } catch (AerospikeException e) {
            log.error("Abort failed for txn={}: {}", txn.getId(), e.getMessage(), e);
            cause.addSuppressed(e);
        }
    }
}
