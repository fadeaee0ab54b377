package com.bank.p2pfraud.service;

import com.aerospike.client.Txn;
import com.bank.p2pfraud.config.MetricsConfig;
import com.bank.p2pfraud.exception.AlreadyResolvedException;
import com.bank.p2pfraud.exception.InsufficientFundsException;
import com.bank.p2pfraud.exception.InvalidTransitionException;
import com.bank.p2pfraud.exception.NotFoundException;
import com.bank.p2pfraud.exception.ValidationException;
import com.bank.p2pfraud.model.Account;
import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.BalanceAdjustmentResult;
import com.bank.p2pfraud.model.BalanceAdjustmentType;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.model.CaseFinding;
import com.bank.p2pfraud.model.CaseStatus;
import com.bank.p2pfraud.model.InvestigationCase;
import com.bank.p2pfraud.model.OverrideResult;
import com.bank.p2pfraud.model.Transaction;
import com.bank.p2pfraud.model.TransactionDetails;
import com.bank.p2pfraud.model.TransactionStatus;
import com.bank.p2pfraud.model.TransactionType;
import com.bank.p2pfraud.repository.AccountRepository;
import com.bank.p2pfraud.repository.AerospikeTransactionRunner;
import com.bank.p2pfraud.repository.CaseRepository;
import com.bank.p2pfraud.repository.TransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Balance movement, the admin override and admin balance adjustments.
 *
 * Every balance change here runs inside the caller's {@link Txn}, together
 * with the status write that licenses it, so both commit or neither does.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    static final String OVERRIDE_REPORT = "Resolved by administrator override";
    private static final String CURRENCY = "USD";

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final CaseRepository caseRepository;
    private final AerospikeTransactionRunner transactionRunner;
    private final AuditLogService auditLogService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public LedgerService(AccountRepository accountRepository,
                         TransactionRepository transactionRepository,
                         CaseRepository caseRepository,
                         AerospikeTransactionRunner transactionRunner,
                         AuditLogService auditLogService,
                         MetricsConfig metricsConfig,
                         Clock clock) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.caseRepository = caseRepository;
        this.transactionRunner = transactionRunner;
        this.auditLogService = auditLogService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Debit the sender and credit the recipient, re-reading both balances in the unit of work.
     *
     * @throws InsufficientFundsException if the sender no longer holds the amount
     */
    public void transfer(String senderId, String recipientId, double amount, Txn txn) {
        if (!tryTransfer(senderId, recipientId, amount, txn)) {
            Account sender = requireAccount(senderId, txn);
            throw new InsufficientFundsException(senderId, sender.getBalance(), amount);
        }
    }

    /**
     * @return false, with no balance change, if the sender cannot cover the amount
     */
    public boolean tryTransfer(String senderId, String recipientId, double amount, Txn txn) {
        Account sender = requireAccount(senderId, txn);
        if (sender.getBalance() < amount) {
            return false;
        }
        accountRepository.updateBalance(senderId, sender.getBalance() - amount, txn);

        if (recipientId != null) {
            Account recipient = requireAccount(recipientId, txn);
            accountRepository.updateBalance(recipientId, recipient.getBalance() + amount, txn);
        }
        return true;
    }

    /**
     * Move an already-settled amount back from the recipient to the sender.
     *
     * @return false, with no balance change, if the recipient no longer holds the amount
     */
    public boolean tryReverse(String senderId, String recipientId, double amount, Txn txn) {
        if (recipientId == null) {
            return false;
        }
        return tryTransfer(recipientId, senderId, amount, txn);
    }

    /**
     * Admin escape hatch for a BLOCKED payment.
     *
     * approve: sender balance is re-checked; the payment settles as
     * SETTLED_BY_OVERRIDE, or becomes REJECTED_INSUFFICIENT_FUNDS without
     * moving funds. reject: REJECTED_FRAUDULENT. Any open case on the payment
     * is resolved in the same unit of work so it cannot apply funds later.
     */
    public OverrideResult adminOverride(CallerContext caller, String txnId, boolean approve) {
        caller.requireRole(AccountRole.ADMIN);
        if (txnId == null || txnId.isBlank()) {
            throw new ValidationException("transactionId is required");
        }

        OverrideResult result = transactionRunner.execute(t -> {
            Transaction txn = transactionRepository.findById(txnId, t);
            if (txn == null) {
                throw new NotFoundException("Transaction not found: " + txnId);
            }
            if (txn.getStatus() != TransactionStatus.BLOCKED) {
                throw new InvalidTransitionException(
                        "Only BLOCKED transactions can be overridden; " + txnId + " is " + txn.getStatus());
            }

            TransactionStatus newStatus;
            boolean moved = false;
            if (approve) {
                moved = tryTransfer(txn.getSenderId(), txn.getRecipientId(), txn.getAmount(), t);
                newStatus = moved ? TransactionStatus.SETTLED_BY_OVERRIDE
                        : TransactionStatus.REJECTED_INSUFFICIENT_FUNDS;
            } else {
                newStatus = TransactionStatus.REJECTED_FRAUDULENT;
            }

            TransactionDetails details = txn.getDetails().toBuilder().processed(moved).build();
            transactionRepository.updateStatus(txnId, newStatus, details, t);

            closeOpenCase(txnId, approve ? CaseFinding.SAFE : CaseFinding.FRAUDULENT, t);
            return new OverrideResult(txnId, newStatus, moved);
        });

        if (approve && !result.fundsMoved()) {
            log.warn("Override approval of {} by {} found insufficient funds, payment rejected",
                    txnId, caller.callerId());
        } else {
            log.info("Override of {} by {}: {}", txnId, caller.callerId(), result.status());
        }
        metricsConfig.recordAdminOverride(approve);
        auditLogService.record(caller.callerId(), approve ? "override_approve" : "override_reject",
                AuditLogService.ENTITY_TRANSACTION, txnId, "status=" + result.status().name());
        return result;
    }

    /**
     * Admin change to a customer balance. The new balance and the
     * ADMIN_ADJUSTMENT transaction recording it commit together.
     */
    public BalanceAdjustmentResult adjustBalance(CallerContext caller, String accountId,
                                                 BalanceAdjustmentType type, double amount, String reason) {
        caller.requireRole(AccountRole.ADMIN);
        if (accountId == null || accountId.isBlank()) {
            throw new ValidationException("accountId is required");
        }
        if (type == null) {
            throw new ValidationException("adjustment type is required");
        }
        if (!Double.isFinite(amount) || amount <= 0) {
            throw new ValidationException("amount must be a positive number");
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason is required");
        }

        BalanceAdjustmentResult result = transactionRunner.execute(t -> {
            Account account = requireAccount(accountId, t);
            if (account.getRole() != AccountRole.CUSTOMER) {
                throw new ValidationException("Only customer balances can be adjusted; " + accountId
                        + " is " + account.getRole());
            }
            double previous = account.getBalance();
            double updated = type.apply(previous, amount);
            accountRepository.updateBalance(accountId, updated, t);

            Transaction adjustment = Transaction.builder()
                    .txnId("TXN-" + UUID.randomUUID().toString().substring(0, 8))
                    .type(TransactionType.ADMIN_ADJUSTMENT)
                    .senderId(accountId)
                    .amount(amount)
                    .currency(CURRENCY)
                    .description(type.getLabel() + ": " + reason.trim())
                    .status(TransactionStatus.SETTLED)
                    .details(TransactionDetails.builder()
                            .processed(true)
                            .adjustedBy(caller.callerId())
                            .adjustmentType(type)
                            .balanceBefore(previous)
                            .balanceAfter(updated)
                            .build())
                    .createdAt(clock.millis())
                    .build();
            transactionRepository.save(adjustment, t);
            return new BalanceAdjustmentResult(accountId, adjustment.getTxnId(), type, previous, updated);
        });

        log.info("Balance of {} adjusted by {} ({} {}): {} -> {}", accountId, caller.callerId(), type, amount,
                result.previousBalance(), result.newBalance());
        metricsConfig.recordBalanceAdjustment(type.name());
        auditLogService.record(caller.callerId(), "balance_adjustment", AuditLogService.ENTITY_USER, accountId,
                String.format("%s $%.2f, new balance $%.2f, reason: %s",
                        type.getLabel(), amount, result.newBalance(), reason.trim()));
        return result;
    }

    private void closeOpenCase(String txnId, CaseFinding finding, Txn t) {
        InvestigationCase open = caseRepository.findByTransactionId(txnId, t);
        if (open == null || open.isResolved()) {
            return;
        }
        InvestigationCase closed = open.toBuilder()
                .status(CaseStatus.RESOLVED)
                .finding(finding)
                .report(OVERRIDE_REPORT)
                .updatedAt(clock.millis())
                .build();
        if (!caseRepository.update(closed, t)) {
            throw new AlreadyResolvedException("Case " + open.getCaseId() + " was resolved concurrently");
        }
    }

    private Account requireAccount(String accountId, Txn txn) {
        Account account = accountRepository.findById(accountId, txn);
        if (account == null) {
            throw new NotFoundException("Account not found: " + accountId);
        }
        return account;
    }
}
