package com.bank.p2pfraud.service;

import com.aerospike.client.Txn;
import com.bank.p2pfraud.config.InvestigationConfig;
import com.bank.p2pfraud.config.MetricsConfig;
import com.bank.p2pfraud.exception.AlreadyResolvedException;
import com.bank.p2pfraud.exception.CaseNotAssignableException;
import com.bank.p2pfraud.exception.DuplicateCaseException;
import com.bank.p2pfraud.exception.InvalidTransitionException;
import com.bank.p2pfraud.exception.NotFoundException;
import com.bank.p2pfraud.exception.UnauthorizedOperationException;
import com.bank.p2pfraud.exception.ValidationException;
import com.bank.p2pfraud.model.Account;
import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.model.CaseDetail;
import com.bank.p2pfraud.model.CaseFinding;
import com.bank.p2pfraud.model.CasePriority;
import com.bank.p2pfraud.model.CaseResolution;
import com.bank.p2pfraud.model.CaseStats;
import com.bank.p2pfraud.model.CaseStatus;
import com.bank.p2pfraud.model.InvestigationCase;
import com.bank.p2pfraud.model.Transaction;
import com.bank.p2pfraud.model.TransactionDetails;
import com.bank.p2pfraud.model.TransactionStatus;
import com.bank.p2pfraud.repository.AccountRepository;
import com.bank.p2pfraud.repository.AerospikeTransactionRunner;
import com.bank.p2pfraud.repository.CaseRepository;
import com.bank.p2pfraud.repository.TransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Investigation case lifecycle: ASSIGNED (queued) -> IN_REVIEW -> RESOLVED.
 *
 * Resolution drives the linked transaction to its terminal status and applies
 * any balance effect in the same unit of work as the case update. Updates to
 * one case are serialized in-process and guarded by a generation check in
 * storage, so a case is resolved at most once.
 */
@Service
public class CaseManagementService {

    private static final Logger log = LoggerFactory.getLogger(CaseManagementService.class);

    private static final int LOCK_STRIPES = 64;
    private static final List<TransactionStatus> PRIOR_FLAG_STATUSES = List.of(
            TransactionStatus.FLAGGED, TransactionStatus.BLOCKED, TransactionStatus.REJECTED_FRAUDULENT);

    private final CaseRepository caseRepository;
    private final TransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final LedgerService ledgerService;
    private final AerospikeTransactionRunner transactionRunner;
    private final AuditLogService auditLogService;
    private final TwilioNotificationService notificationService;
    private final InvestigationConfig investigationConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    private final ReentrantLock[] caseLocks = new ReentrantLock[LOCK_STRIPES];

    public CaseManagementService(CaseRepository caseRepository,
                                 TransactionRepository transactionRepository,
                                 AccountRepository accountRepository,
                                 LedgerService ledgerService,
                                 AerospikeTransactionRunner transactionRunner,
                                 AuditLogService auditLogService,
                                 TwilioNotificationService notificationService,
                                 InvestigationConfig investigationConfig,
                                 MetricsConfig metricsConfig,
                                 Clock clock) {
        this.caseRepository = caseRepository;
        this.transactionRepository = transactionRepository;
        this.accountRepository = accountRepository;
        this.ledgerService = ledgerService;
        this.transactionRunner = transactionRunner;
        this.auditLogService = auditLogService;
        this.notificationService = notificationService;
        this.investigationConfig = investigationConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            caseLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Open a queued case for a payment, in the caller's unit of work.
     *
     * @throws DuplicateCaseException if the payment already has a case that is not resolved
     */
    public InvestigationCase openCase(String txnId, CasePriority priority, Txn txn) {
        InvestigationCase existing = caseRepository.findByTransactionId(txnId, txn);
        if (existing != null && !existing.isResolved()) {
            throw new DuplicateCaseException(
                    "Transaction " + txnId + " already has open case " + existing.getCaseId());
        }

        long now = clock.millis();
        InvestigationCase created = InvestigationCase.builder()
                .caseId("CASE-" + UUID.randomUUID().toString().substring(0, 8))
                .txnId(txnId)
                .status(CaseStatus.ASSIGNED)
                .finding(CaseFinding.NONE)
                .priority(priority)
                .createdAt(now)
                .updatedAt(now)
                .build();
        caseRepository.create(created, txn);
        log.info("Opened case {} for txn {} at priority {}", created.getCaseId(), txnId, priority);
        return created;
    }

    public InvestigationCase assignCase(CallerContext caller, String caseId, String investigatorId) {
        caller.requireRole(AccountRole.ADMIN);

        Account investigator = accountRepository.findById(investigatorId);
        if (investigator == null || investigator.getRole() != AccountRole.INVESTIGATOR || !investigator.isApproved()) {
            throw new CaseNotAssignableException(
                    "Account " + investigatorId + " is not an approved investigator");
        }

        ReentrantLock lock = lockFor(caseId);
        lock.lock();
        try {
            InvestigationCase current = requireCase(caseId, null);
            if (current.isResolved()) {
                throw new CaseNotAssignableException("Case " + caseId + " is already resolved");
            }

            InvestigationCase assigned = current.toBuilder()
                    .assignedTo(investigatorId)
                    .status(CaseStatus.IN_REVIEW)
                    .updatedAt(clock.millis())
                    .build();
            if (!caseRepository.update(assigned, null)) {
                throw new CaseNotAssignableException("Case " + caseId + " changed concurrently, reload and retry");
            }

            log.info("Case {} assigned to {} by {}", caseId, investigatorId, caller.callerId());
            auditLogService.record(caller.callerId(), "assign_case", AuditLogService.ENTITY_CASE, caseId,
                    "investigator=" + investigatorId);
            return assigned;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolve a case and finalize its payment.
     *
     * BLOCKED payment (funds held):
     *   SAFE       -> sender balance re-checked; SETTLED with the transfer, or
     *                 REJECTED_INSUFFICIENT_FUNDS with no balance change
     *   FRAUDULENT -> REJECTED_FRAUDULENT, no balance change
     * FLAGGED payment (funds already moved):
     *   SAFE       -> SETTLED, no balance change
     *   FRAUDULENT -> REJECTED_FRAUDULENT; the transfer is reversed if the
     *                 recipient still holds the amount, otherwise
     *                 details.reversalShortfall is set
     */
    public CaseResolution resolveCase(CallerContext caller, String caseId, CaseFinding finding,
                                      String report, Integer confidence) {
        caller.requireRole(AccountRole.INVESTIGATOR, AccountRole.ADMIN);
        validateResolution(finding, report, confidence);

        ReentrantLock lock = lockFor(caseId);
        lock.lock();
        CaseResolution resolution;
        try {
            resolution = transactionRunner.execute(t -> applyResolution(caller, caseId, finding, report, confidence, t));
        } finally {
            lock.unlock();
        }

        InvestigationCase resolved = resolution.investigationCase();
        if (resolution.transactionStatus() == TransactionStatus.REJECTED_INSUFFICIENT_FUNDS) {
            log.warn("Case {} resolved SAFE but sender can no longer cover txn {}; payment rejected",
                    caseId, resolved.getTxnId());
        } else {
            log.info("Case {} resolved as {} by {}; txn {} -> {}", caseId, finding, caller.callerId(),
                    resolved.getTxnId(), resolution.transactionStatus());
        }

        metricsConfig.recordCaseResolved(finding.name());
        auditLogService.record(caller.callerId(), "resolve_case", AuditLogService.ENTITY_CASE, caseId,
                String.format("finding=%s confidence=%s txnStatus=%s balancesChanged=%s",
                        finding.getLabel(), confidence != null ? confidence + "%" : "n/a",
                        resolution.transactionStatus().name(), resolution.balancesChanged()));

        if (finding == CaseFinding.FRAUDULENT) {
            Transaction txn = transactionRepository.findById(resolved.getTxnId());
            if (txn != null) {
                notificationService.notifyFraudConfirmed(txn, resolved);
            }
        }
        return resolution;
    }

    private CaseResolution applyResolution(CallerContext caller, String caseId, CaseFinding finding,
                                           String report, Integer confidence, Txn t) {
        InvestigationCase current = requireCase(caseId, t);
        if (current.isResolved()) {
            throw new AlreadyResolvedException("Case " + caseId + " is already resolved");
        }
        if (!caller.isAdmin() && !caller.callerId().equals(current.getAssignedTo())) {
            throw new UnauthorizedOperationException(
                    "Case " + caseId + " is not assigned to " + caller.callerId());
        }

        Transaction txn = transactionRepository.findById(current.getTxnId(), t);
        if (txn == null) {
            throw new NotFoundException("Transaction not found for case " + caseId + ": " + current.getTxnId());
        }

        TransactionDetails.TransactionDetailsBuilder details = txn.getDetails().toBuilder();
        TransactionStatus newStatus;
        boolean balancesChanged = false;

        if (txn.getStatus() == TransactionStatus.BLOCKED) {
            if (finding == CaseFinding.SAFE) {
                balancesChanged = ledgerService.tryTransfer(
                        txn.getSenderId(), txn.getRecipientId(), txn.getAmount(), t);
                newStatus = balancesChanged ? TransactionStatus.SETTLED
                        : TransactionStatus.REJECTED_INSUFFICIENT_FUNDS;
                details.processed(balancesChanged);
            } else {
                newStatus = TransactionStatus.REJECTED_FRAUDULENT;
            }
        } else if (txn.getStatus() == TransactionStatus.FLAGGED) {
            if (finding == CaseFinding.SAFE) {
                newStatus = TransactionStatus.SETTLED;
            } else {
                newStatus = TransactionStatus.REJECTED_FRAUDULENT;
                balancesChanged = ledgerService.tryReverse(
                        txn.getSenderId(), txn.getRecipientId(), txn.getAmount(), t);
                if (!balancesChanged) {
                    details.reversalShortfall(true);
                }
            }
        } else {
            throw new InvalidTransitionException(
                    "Transaction " + txn.getTxnId() + " is already " + txn.getStatus());
        }

        transactionRepository.updateStatus(txn.getTxnId(), newStatus, details.build(), t);

        InvestigationCase resolved = current.toBuilder()
                .status(CaseStatus.RESOLVED)
                .finding(finding)
                .report(report.trim())
                .confidence(confidence)
                .updatedAt(clock.millis())
                .build();
        if (!caseRepository.update(resolved, t)) {
            throw new AlreadyResolvedException("Case " + caseId + " was resolved concurrently");
        }
        return new CaseResolution(resolved, newStatus, balancesChanged);
    }

    private void validateResolution(CaseFinding finding, String report, Integer confidence) {
        if (finding == null || finding == CaseFinding.NONE) {
            throw new ValidationException("finding must be SAFE or FRAUDULENT");
        }
        int minLength = investigationConfig.getMinReportLength();
        if (report == null || report.trim().length() < minLength) {
            throw new ValidationException("Investigation report must be at least " + minLength + " characters");
        }
        if (confidence != null && (confidence < 0 || confidence > investigationConfig.getMaxConfidence())) {
            throw new ValidationException(
                    "confidence must be between 0 and " + investigationConfig.getMaxConfidence());
        }
    }

    /**
     * Investigators see only their own cases; admins may list anyone's.
     */
    public List<InvestigationCase> listCasesForInvestigator(CallerContext caller, String investigatorId,
                                                            CaseStatus statusFilter) {
        caller.requireRole(AccountRole.INVESTIGATOR, AccountRole.ADMIN);
        if (!caller.isAdmin() && !caller.callerId().equals(investigatorId)) {
            throw new UnauthorizedOperationException("Investigators may only list their own cases");
        }
        return caseRepository.findByFilters(investigatorId, statusFilter, false);
    }

    public List<InvestigationCase> listUnassigned(CallerContext caller) {
        caller.requireRole(AccountRole.ADMIN);
        return caseRepository.findByFilters(null, CaseStatus.ASSIGNED, true);
    }

    public CaseDetail getCaseDetail(CallerContext caller, String caseId) {
        caller.requireRole(AccountRole.INVESTIGATOR, AccountRole.ADMIN);
        InvestigationCase c = requireCase(caseId, null);
        if (!caller.isAdmin() && !caller.callerId().equals(c.getAssignedTo())) {
            throw new UnauthorizedOperationException("Case " + caseId + " is not assigned to " + caller.callerId());
        }

        Transaction txn = transactionRepository.findById(c.getTxnId());
        if (txn == null) {
            throw new NotFoundException("Transaction not found for case " + caseId + ": " + c.getTxnId());
        }

        // Display-only relationship signals
        boolean firstInteraction = !transactionRepository.existsBySenderAndRecipient(
                txn.getSenderId(), txn.getRecipientId(), txn.getCreatedAt());
        long priorFlagged = transactionRepository.countBySenderAndStatuses(
                txn.getSenderId(), PRIOR_FLAG_STATUSES, txn.getTxnId());

        return CaseDetail.builder()
                .investigationCase(c)
                .transaction(txn)
                .sender(accountRepository.findById(txn.getSenderId()))
                .recipient(accountRepository.findById(txn.getRecipientId()))
                .firstInteraction(firstInteraction)
                .senderPriorFlaggedCount(priorFlagged)
                .build();
    }

    public CaseStats getStats(CallerContext caller) {
        caller.requireRole(AccountRole.INVESTIGATOR, AccountRole.ADMIN);
        return new CaseStats(caseRepository.countByStatus(), caseRepository.countByFinding());
    }

    private InvestigationCase requireCase(String caseId, Txn txn) {
        InvestigationCase c = caseRepository.findById(caseId, txn);
        if (c == null) {
            throw new NotFoundException("Case not found: " + caseId);
        }
        return c;
    }

    private ReentrantLock lockFor(String caseId) {
        return caseLocks[Math.floorMod(caseId.hashCode(), LOCK_STRIPES)];
    }
}
