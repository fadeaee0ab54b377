package com.bank.p2pfraud.service;

import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.model.Transaction;
import com.bank.p2pfraud.model.TransactionType;
import com.bank.p2pfraud.model.VelocityCheckResult;
import com.bank.p2pfraud.model.VelocityLimits;
import com.bank.p2pfraud.model.VelocitySnapshot;
import com.bank.p2pfraud.exception.UnauthorizedOperationException;
import com.bank.p2pfraud.repository.TransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rolling 1-hour and 24-hour usage of a sender, anchored at now.
 *
 * Only SETTLED and FLAGGED payments count; blocked and rejected ones are
 * excluded. Read-only: nothing here writes.
 *
 * Note: the read here and the ledger write that follows are not mutually
 * exclusive across concurrent requests from the same sender, so two
 * simultaneous payments may both pass a limit they would jointly exceed.
 */
@Service
public class VelocityCheckService {

    private static final Logger log = LoggerFactory.getLogger(VelocityCheckService.class);

    private static final long ONE_HOUR_MS = Duration.ofHours(1).toMillis();
    private static final long ONE_DAY_MS = Duration.ofHours(24).toMillis();

    private final TransactionRepository transactionRepository;
    private final SettingsService settingsService;
    private final Clock clock;

    public VelocityCheckService(TransactionRepository transactionRepository,
                                SettingsService settingsService,
                                Clock clock) {
        this.transactionRepository = transactionRepository;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    /**
     * Compute usage and the limits the candidate payment would break.
     */
    public VelocityCheckResult check(String senderId, double candidateAmount) {
        VelocitySnapshot snapshot = snapshot(senderId);
        VelocityLimits limits = settingsService.getSettings().getVelocityLimits();
        List<String> violations = new ArrayList<>();

        double amount1h = snapshot.getAmount1h() + candidateAmount;
        if (amount1h > limits.getMaxAmount1h()) {
            violations.add(String.format("1h amount limit exceeded: $%.2f", amount1h));
        }
        int count1h = snapshot.getCount1h() + 1;
        if (count1h > limits.getMaxCount1h()) {
            violations.add("1h transaction count exceeded: " + count1h);
        }

        double amount24h = snapshot.getAmount24h() + candidateAmount;
        if (amount24h > limits.getMaxAmount24h()) {
            violations.add(String.format("24h amount limit exceeded: $%.2f", amount24h));
        }
        int count24h = snapshot.getCount24h() + 1;
        if (count24h > limits.getMaxCount24h()) {
            violations.add("24h transaction count exceeded: " + count24h);
        }

        if (snapshot.getUniqueRecipients24h() > limits.getMaxUniqueRecipients24h()) {
            violations.add("Too many unique recipients: " + snapshot.getUniqueRecipients24h());
        }

        if (!violations.isEmpty()) {
            log.debug("Velocity violations for sender {}: {}", senderId, violations);
        }
        return new VelocityCheckResult(violations, snapshot);
    }

    public VelocitySnapshot snapshot(String senderId) {
        long now = clock.millis();
        long hourAgo = now - ONE_HOUR_MS;
        long dayAgo = now - ONE_DAY_MS;

        double amount1h = 0.0;
        double amount24h = 0.0;
        int count1h = 0;
        int count24h = 0;
        Set<String> recipients = new HashSet<>();

        for (Transaction txn : transactionRepository.findBySenderSince(senderId, dayAgo)) {
            if (txn.getType() == TransactionType.ADMIN_ADJUSTMENT) continue;
            if (txn.getStatus() == null || !txn.getStatus().countsTowardVelocity()) continue;

            amount24h += txn.getAmount();
            count24h++;
            if (txn.getRecipientId() != null) {
                recipients.add(txn.getRecipientId());
            }
            if (txn.getCreatedAt() >= hourAgo) {
                amount1h += txn.getAmount();
                count1h++;
            }
        }

        return new VelocitySnapshot(amount1h, amount24h, count1h, count24h, recipients.size());
    }

    /**
     * Snapshot for display. Customers may only read their own.
     */
    public VelocitySnapshot getVelocitySnapshot(CallerContext caller, String userId) {
        if (caller.role() == AccountRole.CUSTOMER && !caller.callerId().equals(userId)) {
            throw new UnauthorizedOperationException("Customers may only view their own velocity");
        }
        return snapshot(userId);
    }
}
