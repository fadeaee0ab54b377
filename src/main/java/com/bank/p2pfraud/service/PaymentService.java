package com.bank.p2pfraud.service;

import com.bank.p2pfraud.config.MetricsConfig;
import com.bank.p2pfraud.engine.EvaluationContext;
import com.bank.p2pfraud.engine.RuleEngine;
import com.bank.p2pfraud.engine.model.FeatureExtractor;
import com.bank.p2pfraud.engine.model.FraudScorer;
import com.bank.p2pfraud.exception.InsufficientFundsException;
import com.bank.p2pfraud.exception.NotFoundException;
import com.bank.p2pfraud.exception.ScoringUnavailableException;
import com.bank.p2pfraud.exception.UnauthorizedOperationException;
import com.bank.p2pfraud.exception.ValidationException;
import com.bank.p2pfraud.model.Account;
import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.model.DeviceAssessment;
import com.bank.p2pfraud.model.PagedResponse;
import com.bank.p2pfraud.model.PaymentOutcome;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.PaymentResult;
import com.bank.p2pfraud.model.RiskDecision;
import com.bank.p2pfraud.model.RuleEvaluation;
import com.bank.p2pfraud.model.RuleResult;
import com.bank.p2pfraud.model.RuleType;
import com.bank.p2pfraud.model.Settings;
import com.bank.p2pfraud.model.Transaction;
import com.bank.p2pfraud.model.TransactionDetails;
import com.bank.p2pfraud.model.TransactionStatus;
import com.bank.p2pfraud.model.TransactionType;
import com.bank.p2pfraud.model.VelocityCheckResult;
import com.bank.p2pfraud.repository.AccountRepository;
import com.bank.p2pfraud.repository.AerospikeTransactionRunner;
import com.bank.p2pfraud.repository.TransactionRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Main orchestrator for payment submission.
 *
 * Flow:
 * 1. Validate the request and both parties; reject if the sender cannot cover the amount
 * 2. Read the sender's rolling velocity and recent history
 * 3. Score the feature vector with the fraud scorer (falls back to rules only on failure)
 * 4. Run all risk rules via the RuleEngine
 * 5. Map the scores to SETTLED / FLAGGED / BLOCKED via RiskDecisionService
 * 6. In one unit of work: write the transaction, move funds if the outcome allows,
 *    open a case for FLAGGED / BLOCKED
 * 7. Audit, notify and return the result
 */
@Service
public class PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    static final int HISTORY_SIZE = 20;
    static final int AVERAGE_WINDOW = 10;
    static final double ML_FACTOR_THRESHOLD = 0.5;
    private static final String CURRENCY = "USD";

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final AerospikeTransactionRunner transactionRunner;
    private final SettingsService settingsService;
    private final VelocityCheckService velocityCheckService;
    private final FraudScorer fraudScorer;
    private final RuleEngine ruleEngine;
    private final RiskDecisionService riskDecisionService;
    private final LedgerService ledgerService;
    private final CaseManagementService caseManagementService;
    private final PatternDetector patternDetector;
    private final DeviceFingerprintService deviceFingerprintService;
    private final AuditLogService auditLogService;
    private final TwilioNotificationService notificationService;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public PaymentService(AccountRepository accountRepository,
                          TransactionRepository transactionRepository,
                          AerospikeTransactionRunner transactionRunner,
                          SettingsService settingsService,
                          VelocityCheckService velocityCheckService,
                          FraudScorer fraudScorer,
                          RuleEngine ruleEngine,
                          RiskDecisionService riskDecisionService,
                          LedgerService ledgerService,
                          CaseManagementService caseManagementService,
                          PatternDetector patternDetector,
                          DeviceFingerprintService deviceFingerprintService,
                          AuditLogService auditLogService,
                          TwilioNotificationService notificationService,
                          MetricsConfig metricsConfig,
                          Clock clock) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.transactionRunner = transactionRunner;
        this.settingsService = settingsService;
        this.velocityCheckService = velocityCheckService;
        this.fraudScorer = fraudScorer;
        this.ruleEngine = ruleEngine;
        this.riskDecisionService = riskDecisionService;
        this.ledgerService = ledgerService;
        this.caseManagementService = caseManagementService;
        this.patternDetector = patternDetector;
        this.deviceFingerprintService = deviceFingerprintService;
        this.auditLogService = auditLogService;
        this.notificationService = notificationService;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    /**
     * Submit a payment. This is the main entry point called by the REST controller.
     *
     * @throws InsufficientFundsException if the sender cannot cover the amount; nothing is written
     */
    @Observed(name = "payment.submit", contextualName = "submit-payment")
    public PaymentResult submitPayment(CallerContext caller, PaymentRequest request) {
        validateRequest(caller, request);

        Account sender = requireApprovedAccount(request.getSenderId(), "sender");
        Account recipient = requireApprovedAccount(request.getRecipientId(), "recipient");
        double amount = request.getAmount();

        // 1. Balance gate before any scoring
        if (sender.getBalance() < amount) {
            throw new InsufficientFundsException(sender.getAccountId(), sender.getBalance(), amount);
        }

        Settings settings = settingsService.getSettings();
        long nowMillis = clock.millis();
        LocalDateTime now = LocalDateTime.now(clock);

        // 2. History and velocity
        VelocityCheckResult velocity = velocityCheckService.check(sender.getAccountId(), amount);
        List<Transaction> recent = transactionRepository.findRecentBySender(sender.getAccountId(), HISTORY_SIZE)
                .stream()
                .filter(t -> t.getType() == TransactionType.PAYMENT)
                .toList();
        boolean recipientNew = !transactionRepository.existsBySenderAndRecipient(
                sender.getAccountId(), recipient.getAccountId(), nowMillis);

        // 3. Predictive score
        Double mlProbability = scoreSafely(request, now, sender.getBalance(), recipientNew, velocity, settings);

        // 4. Rules
        EvaluationContext context = EvaluationContext.builder()
                .settings(settings)
                .sender(sender)
                .velocity(velocity.snapshot())
                .historicalAverageAmount(averageAmount(recent))
                .submittedAt(now)
                .submittedAtMillis(nowMillis)
                .build();
        RuleEvaluation rules = ruleEngine.evaluateAll(request, context);

        // 5. Decision
        RiskDecision decision = riskDecisionService.decide(mlProbability, rules.ruleScore());
        PaymentOutcome outcome = decision.outcome();

        List<String> factors = new ArrayList<>(rules.factors());
        if (mlProbability != null && mlProbability > ML_FACTOR_THRESHOLD) {
            factors.add(String.format("ML model flagged: %.1f%% fraud probability", mlProbability * 100.0));
        }

        List<Transaction> chronological = new ArrayList<>(recent);
        Collections.reverse(chronological);
        DeviceAssessment device = deviceFingerprintService.assess(sender.getAccountId(),
                request.getDeviceSignature(), request.getScreenResolution(),
                request.getTimezone(), request.getIpAddress());

        TransactionDetails details = TransactionDetails.builder()
                .riskFactors(factors)
                .mlProbability(mlProbability)
                .ruleScore(decision.ruleScore())
                .finalScore(decision.finalScore())
                .processed(decision.isFundsMoveNow())
                .scoringFallback(decision.isScoringFallback())
                .fraudIndicators(fraudIndicators(request, rules, settings, now))
                .velocityViolations(velocity.violations())
                .velocity(velocity.snapshot())
                .suspiciousPatterns(patternDetector.detect(amount, request.getDescription(), chronological))
                .device(device)
                .build();

        Transaction txn = Transaction.builder()
                .txnId("TXN-" + UUID.randomUUID().toString().substring(0, 8))
                .senderId(sender.getAccountId())
                .recipientId(recipient.getAccountId())
                .amount(amount)
                .currency(CURRENCY)
                .description(request.getDescription())
                .ipAddress(request.getIpAddress())
                .deviceSignature(request.getDeviceSignature())
                .location(request.getLocation())
                .status(outcome.getInitialStatus())
                .riskScore(decision.finalScore())
                .details(details)
                .createdAt(nowMillis)
                .build();

        // 6. Status, balances and case commit together
        transactionRunner.execute(t -> {
            if (outcome.isFundsMoveNow()) {
                ledgerService.transfer(txn.getSenderId(), txn.getRecipientId(), amount, t);
            }
            transactionRepository.save(txn, t);
            if (outcome.requiresCase()) {
                caseManagementService.openCase(txn.getTxnId(), outcome.casePriority(), t);
            }
            return txn.getTxnId();
        });

        // 7. Side effects after commit
        log.info("Payment {} from {} to {} amount={} -> {} (final={}, rule={}, ml={})",
                txn.getTxnId(), txn.getSenderId(), txn.getRecipientId(), amount, outcome,
                String.format("%.3f", decision.finalScore()), String.format("%.3f", decision.ruleScore()),
                mlProbability != null ? String.format("%.3f", mlProbability) : "fallback");
        metricsConfig.recordPaymentOutcome(outcome.name(), decision.finalScore());
        auditLogService.record(caller.callerId(), "process_payment", AuditLogService.ENTITY_TRANSACTION,
                txn.getTxnId(), String.format("amount=%.2f outcome=%s score=%.3f",
                        amount, outcome.name(), decision.finalScore()));
        if (outcome == PaymentOutcome.BLOCKED) {
            notificationService.notifyPaymentBlocked(txn, decision.finalScore(), factors);
        }

        return new PaymentResult(txn.getTxnId(), outcome, decision.finalScore(),
                List.copyOf(factors), recipient.getDisplayName());
    }

    public Transaction getTransaction(CallerContext caller, String txnId) {
        Transaction txn = transactionRepository.findById(txnId);
        if (txn == null) {
            throw new NotFoundException("Transaction not found: " + txnId);
        }
        if (caller.role() == AccountRole.CUSTOMER
                && !caller.callerId().equals(txn.getSenderId())
                && !caller.callerId().equals(txn.getRecipientId())) {
            throw new UnauthorizedOperationException("Transaction " + txnId + " does not belong to " + caller.callerId());
        }
        return txn;
    }

    public PagedResponse<Transaction> listByStatus(CallerContext caller, TransactionStatus status, int limit, Long before) {
        caller.requireRole(AccountRole.ADMIN, AccountRole.INVESTIGATOR);
        requirePositiveLimit(limit);
        return transactionRepository.findByStatus(status, limit, before);
    }

    public PagedResponse<Transaction> listBySender(CallerContext caller, String senderId, int limit, Long before) {
        if (caller.role() == AccountRole.CUSTOMER && !caller.callerId().equals(senderId)) {
            throw new UnauthorizedOperationException("Customers may only list their own payments");
        }
        requirePositiveLimit(limit);
        return transactionRepository.findBySender(senderId, limit, before);
    }

    private static void requirePositiveLimit(int limit) {
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1");
        }
    }

    private void validateRequest(CallerContext caller, PaymentRequest request) {
        if (request == null) {
            throw new ValidationException("Payment request is required");
        }
        if (!Double.isFinite(request.getAmount()) || request.getAmount() <= 0) {
            throw new ValidationException("amount must be a positive number");
        }
        if (request.getSenderId() == null || request.getSenderId().isBlank()) {
            throw new ValidationException("senderId is required");
        }
        if (request.getRecipientId() == null || request.getRecipientId().isBlank()) {
            throw new ValidationException("recipientId is required");
        }
        if (request.getSenderId().equals(request.getRecipientId())) {
            throw new ValidationException("sender and recipient must differ");
        }
        if (request.getFailedAttempts() < 0) {
            throw new ValidationException("failedAttempts must not be negative");
        }
        if (!caller.isAdmin() && !caller.callerId().equals(request.getSenderId())) {
            throw new UnauthorizedOperationException("Payments may only be submitted by the sending account");
        }
    }

    private Account requireApprovedAccount(String accountId, String party) {
        Account account = accountRepository.findById(accountId);
        if (account == null) {
            throw new ValidationException("Unknown " + party + ": " + accountId);
        }
        if (!account.isApproved()) {
            throw new ValidationException("The " + party + " account " + accountId + " is not approved");
        }
        return account;
    }

    private Double scoreSafely(PaymentRequest request, LocalDateTime now, double senderBalance,
                               boolean recipientNew, VelocityCheckResult velocity, Settings settings) {
        try {
            double[] features = FeatureExtractor.extract(request, now, senderBalance, recipientNew,
                    velocity.snapshot(), settings.getHighRiskLocations());
            double probability = fraudScorer.predict(features);
            if (Double.isNaN(probability)) {
                throw new IllegalStateException("Scorer returned NaN");
            }
            return probability;
        } catch (Exception e) {
            ScoringUnavailableException unavailable = new ScoringUnavailableException(
                    "Fraud scorer unavailable for sender " + request.getSenderId() + ", using rule score only", e);
            log.warn(unavailable.getMessage(), unavailable);
            metricsConfig.recordScorerFallback();
            return null;
        }
    }

    private static double averageAmount(List<Transaction> recentNewestFirst) {
        return recentNewestFirst.stream()
                .limit(AVERAGE_WINDOW)
                .mapToDouble(Transaction::getAmount)
                .average()
                .orElse(0.0);
    }

    private static Map<String, Boolean> fraudIndicators(PaymentRequest request, RuleEvaluation rules,
                                                        Settings settings, LocalDateTime now) {
        Map<String, Boolean> indicators = new LinkedHashMap<>();
        indicators.put("highAmount", request.getAmount() > settings.getTxLimitAmount());
        indicators.put("unusualLocation", settings.isHighRiskLocation(request.getLocation()));
        indicators.put("suspiciousDevice", triggered(rules, RuleType.SUSPICIOUS_DEVICE));
        indicators.put("roundAmount", triggered(rules, RuleType.ROUND_AMOUNT));
        indicators.put("unusualTime", triggered(rules, RuleType.UNUSUAL_HOUR));
        indicators.put("excessiveAuthFailures", request.getFailedAttempts() >= settings.getMaxFailedAttempts());
        return indicators;
    }

    private static boolean triggered(RuleEvaluation rules, RuleType type) {
        return rules.results().stream()
                .anyMatch(r -> r.getRuleType() == type && r.isTriggered());
    }
}
