package com.bank.p2pfraud.service;

import com.bank.p2pfraud.config.InvestigationConfig;
import com.bank.p2pfraud.config.MetricsConfig;
import com.bank.p2pfraud.engine.RuleEngine;
import com.bank.p2pfraud.engine.evaluators.*;
import com.bank.p2pfraud.engine.model.FraudScorer;
import com.bank.p2pfraud.exception.AlreadyResolvedException;
import com.bank.p2pfraud.exception.InsufficientFundsException;
import com.bank.p2pfraud.exception.UnauthorizedOperationException;
import com.bank.p2pfraud.exception.ValidationException;
import com.bank.p2pfraud.model.*;
import com.bank.p2pfraud.repository.AccountRepository;
import com.bank.p2pfraud.repository.AerospikeTransactionRunner;
import com.bank.p2pfraud.repository.CaseRepository;
import com.bank.p2pfraud.repository.TransactionRepository;
import com.bank.p2pfraud.testutil.InMemoryLedger;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.bank.p2pfraud.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentServiceTest {

    @Mock private AccountRepository accountRepository;
    @Mock private TransactionRepository transactionRepository;
    @Mock private CaseRepository caseRepository;
    @Mock private AerospikeTransactionRunner transactionRunner;
    @Mock private SettingsService settingsService;
    @Mock private FraudScorer fraudScorer;
    @Mock private AuditLogService auditLogService;
    @Mock private TwilioNotificationService notificationService;
    @Mock private MetricsConfig metricsConfig;

    private final Clock clock = fixedClock();
    private InMemoryLedger ledger;
    private VelocityCheckService velocityCheckService;
    private CaseManagementService caseManagementService;
    private PaymentService paymentService;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryLedger();
        ledger.wire(accountRepository, transactionRepository, caseRepository, transactionRunner);
        ledger.put(createAccount(SENDER_ID, AccountRole.CUSTOMER, 10000.0));
        ledger.put(createAccount(RECIPIENT_ID, AccountRole.CUSTOMER, 8000.0));
        ledger.put(createAccount(INVESTIGATOR_ID, AccountRole.INVESTIGATOR, 0.0));

        lenient().when(settingsService.getSettings()).thenAnswer(inv -> defaultSettings());

        RuleEngine ruleEngine = new RuleEngine(List.of(
                new TransactionAmountEvaluator(), new RoundAmountEvaluator(), new MicroTransactionEvaluator(),
                new HighRiskLocationEvaluator(), new SuspiciousDeviceEvaluator(),
                new FailedAuthenticationEvaluator(), new VelocityCountEvaluator(), new VelocityAmountEvaluator(),
                new AmountSpikeEvaluator(), new AccountAgeEvaluator(), new UnusualHourEvaluator(),
                new WeekendEvaluator()), Tracer.NOOP, metricsConfig);

        LedgerService ledgerService = new LedgerService(accountRepository, transactionRepository, caseRepository,
                transactionRunner, auditLogService, metricsConfig, clock);
        caseManagementService = new CaseManagementService(caseRepository, transactionRepository,
                accountRepository, ledgerService, transactionRunner, auditLogService, notificationService,
                new InvestigationConfig(), metricsConfig, clock);
        velocityCheckService = new VelocityCheckService(transactionRepository, settingsService, clock);

        paymentService = new PaymentService(accountRepository, transactionRepository, transactionRunner,
                settingsService, velocityCheckService, fraudScorer, ruleEngine,
                new RiskDecisionService(settingsService), ledgerService, caseManagementService,
                new PatternDetector(), new DeviceFingerprintService(), auditLogService, notificationService,
                metricsConfig, clock);
    }

    @Test
    void submitPayment_smallNormalPayment_settlesAndMovesFunds() {
        when(fraudScorer.predict(any())).thenReturn(0.05);

        PaymentResult result = paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 50.0));

        assertThat(result.outcome()).isEqualTo(PaymentOutcome.SETTLED);
        assertThat(result.riskFactors()).isEmpty();
        assertThat(result.recipientDisplayName()).isEqualTo("Test " + RECIPIENT_ID);
        assertThat(ledger.balance(SENDER_ID)).isEqualTo(9950.0);
        assertThat(ledger.balance(RECIPIENT_ID)).isEqualTo(8050.0);

        Transaction saved = ledger.transaction(result.transactionId());
        assertThat(saved.getStatus()).isEqualTo(TransactionStatus.SETTLED);
        assertThat(saved.getCurrency()).isEqualTo("USD");
        assertThat(saved.getDetails().isProcessed()).isTrue();
        assertThat(saved.getDetails().getMlProbability()).isEqualTo(0.05);
        assertThat(ledger.cases()).isEmpty();
        verify(notificationService, never()).notifyPaymentBlocked(any(), anyDouble(), any());
        verify(auditLogService).record(eq(SENDER_ID), eq("process_payment"), eq("transaction"),
                eq(result.transactionId()), anyString());
    }

    @Test
    void submitPayment_overLimitHighModelScore_blocksWithoutMovingFunds() {
        when(fraudScorer.predict(any())).thenReturn(0.9);

        PaymentResult result = paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 7000.0));

        assertThat(result.outcome()).isEqualTo(PaymentOutcome.BLOCKED);
        assertThat(result.finalScore()).isGreaterThanOrEqualTo(0.7);
        assertThat(result.riskFactors()).containsExactly(
                "Large transaction amount exceeds $5000 limit",
                "Round amount pattern detected (potential manual fraud)",
                "ML model flagged: 90.0% fraud probability");
        assertThat(ledger.balance(SENDER_ID)).isEqualTo(10000.0);
        assertThat(ledger.balance(RECIPIENT_ID)).isEqualTo(8000.0);

        Transaction saved = ledger.transaction(result.transactionId());
        assertThat(saved.getStatus()).isEqualTo(TransactionStatus.BLOCKED);
        assertThat(saved.getDetails().isProcessed()).isFalse();
        assertThat(saved.getDetails().getFraudIndicators())
                .containsEntry("highAmount", true)
                .containsEntry("roundAmount", true)
                .containsEntry("unusualLocation", false);

        InvestigationCase opened = ledger.caseFor(result.transactionId());
        assertThat(opened).isNotNull();
        assertThat(opened.getPriority()).isEqualTo(CasePriority.HIGH);
        assertThat(opened.getStatus()).isEqualTo(CaseStatus.ASSIGNED);
        assertThat(ledger.cases()).hasSize(1);
        verify(notificationService).notifyPaymentBlocked(any(Transaction.class), eq(result.finalScore()),
                eq(result.riskFactors()));
    }

    @Test
    void submitPayment_microAmountWithScorerDown_fallsBackToRulesAndFlags() {
        when(fraudScorer.predict(any())).thenThrow(new IllegalStateException("model not loaded"));

        PaymentResult result = paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 0.50));

        assertThat(result.outcome()).isEqualTo(PaymentOutcome.FLAGGED);
        assertThat(result.finalScore()).isCloseTo(0.40, within(1e-9));
        assertThat(result.riskFactors()).containsExactly("Micro-transaction pattern (potential card testing)");
        assertThat(ledger.balance(SENDER_ID)).isEqualTo(9999.5);

        Transaction saved = ledger.transaction(result.transactionId());
        assertThat(saved.getStatus()).isEqualTo(TransactionStatus.FLAGGED);
        assertThat(saved.getDetails().isScoringFallback()).isTrue();
        assertThat(saved.getDetails().getMlProbability()).isNull();
        assertThat(ledger.caseFor(result.transactionId()).getPriority()).isEqualTo(CasePriority.MEDIUM);
        verify(metricsConfig).recordScorerFallback();
    }

    @Test
    void submitPayment_scorerReturnsNaN_isTreatedAsUnavailable() {
        when(fraudScorer.predict(any())).thenReturn(Double.NaN);

        PaymentResult result = paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 50.0));

        assertThat(result.outcome()).isEqualTo(PaymentOutcome.SETTLED);
        assertThat(ledger.transaction(result.transactionId()).getDetails().isScoringFallback()).isTrue();
    }

    @Test
    void submitPayment_insufficientBalance_rejectsBeforeScoringAndWritesNothing() {
        ledger.put(createAccount(SENDER_ID, AccountRole.CUSTOMER, 100.0));

        assertThatThrownBy(() -> paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 500.0)))
                .isInstanceOf(InsufficientFundsException.class);

        assertThat(ledger.transactions()).isEmpty();
        assertThat(ledger.balance(SENDER_ID)).isEqualTo(100.0);
        verifyNoInteractions(fraudScorer);
    }

    @Test
    void submitPayment_balanceDrainedBeforeCommit_rollsBackEverything() {
        when(fraudScorer.predict(any())).thenReturn(0.05);
        // balance read at validation passes, the re-read inside the unit of work does not
        when(accountRepository.findById(eq(SENDER_ID), any()))
                .thenReturn(createAccount(SENDER_ID, AccountRole.CUSTOMER, 10.0));

        assertThatThrownBy(() -> paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 50.0)))
                .isInstanceOf(InsufficientFundsException.class);

        assertThat(ledger.transactions()).isEmpty();
        assertThat(ledger.balance(SENDER_ID)).isEqualTo(10000.0);
        assertThat(ledger.balance(RECIPIENT_ID)).isEqualTo(8000.0);
    }

    @Test
    void submitPayment_invalidRequests_areRejected() {
        assertThatThrownBy(() -> paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 0.0)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, Double.POSITIVE_INFINITY)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, SENDER_ID, 10.0)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, "USR-NOPE", 10.0)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unknown recipient");

        assertThat(ledger.transactions()).isEmpty();
    }

    @Test
    void submitPayment_pendingRecipient_isRejected() {
        Account pending = createAccount("USR-0009", AccountRole.CUSTOMER, 0.0);
        pending.setStatus(AccountStatus.PENDING);
        ledger.put(pending);

        assertThatThrownBy(() -> paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, "USR-0009", 10.0)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("not approved");
    }

    @Test
    void submitPayment_onBehalfOfAnotherCustomer_isUnauthorized() {
        assertThatThrownBy(() -> paymentService.submitPayment(customer(RECIPIENT_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 10.0)))
                .isInstanceOf(UnauthorizedOperationException.class);
    }

    @Test
    void blockedPayment_resolvedSafe_settlesOnceAndSecondResolutionFails() {
        when(fraudScorer.predict(any())).thenReturn(0.9);
        PaymentResult blocked = paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 7000.0));
        String caseId = ledger.caseFor(blocked.transactionId()).getCaseId();

        caseManagementService.assignCase(admin(), caseId, INVESTIGATOR_ID);
        CaseResolution resolution = caseManagementService.resolveCase(investigator(), caseId,
                CaseFinding.SAFE, report(), 80);

        assertThat(resolution.transactionStatus()).isEqualTo(TransactionStatus.SETTLED);
        assertThat(resolution.balancesChanged()).isTrue();
        assertThat(ledger.balance(SENDER_ID)).isEqualTo(3000.0);
        assertThat(ledger.balance(RECIPIENT_ID)).isEqualTo(15000.0);

        assertThatThrownBy(() -> caseManagementService.resolveCase(investigator(), caseId,
                CaseFinding.FRAUDULENT, report(), 90))
                .isInstanceOf(AlreadyResolvedException.class);
        assertThat(ledger.balance(SENDER_ID)).isEqualTo(3000.0);
        assertThat(ledger.balance(RECIPIENT_ID)).isEqualTo(15000.0);
        assertThat(ledger.transaction(blocked.transactionId()).getStatus()).isEqualTo(TransactionStatus.SETTLED);
    }

    @Test
    void blockedPayment_resolvedFraudulent_keepsBalances() {
        when(fraudScorer.predict(any())).thenReturn(0.9);
        PaymentResult blocked = paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 7000.0));
        String caseId = ledger.caseFor(blocked.transactionId()).getCaseId();

        CaseResolution resolution = caseManagementService.resolveCase(admin(), caseId,
                CaseFinding.FRAUDULENT, report(), null);

        assertThat(resolution.transactionStatus()).isEqualTo(TransactionStatus.REJECTED_FRAUDULENT);
        assertThat(ledger.balance(SENDER_ID)).isEqualTo(10000.0);
        assertThat(ledger.balance(RECIPIENT_ID)).isEqualTo(8000.0);
    }

    @Test
    void velocity_sequentialPayments_secondSeesFirst() {
        ledger.put(createAccount(SENDER_ID, AccountRole.CUSTOMER, 20000.0));
        when(fraudScorer.predict(any())).thenReturn(0.05);

        paymentService.submitPayment(customer(SENDER_ID), createPaymentRequest(SENDER_ID, RECIPIENT_ID, 4000.0));
        PaymentResult second = paymentService.submitPayment(customer(SENDER_ID),
                createPaymentRequest(SENDER_ID, RECIPIENT_ID, 4000.0));

        Transaction saved = ledger.transaction(second.transactionId());
        assertThat(saved.getDetails().getVelocityViolations()).contains("1h amount limit exceeded: $8000.00");
        assertThat(saved.getDetails().getVelocity().getCount1h()).isEqualTo(1);
    }

    @Test
    void velocity_concurrentPayments_bothReadHistoryBeforeEitherCommits() throws Exception {
        ledger.put(createAccount(SENDER_ID, AccountRole.CUSTOMER, 20000.0));
        when(fraudScorer.predict(any())).thenReturn(0.05);
        CyclicBarrier bothRead = new CyclicBarrier(2);
        ledger.beforeVelocityRead(() -> {
            try {
                bothRead.await(5, TimeUnit.SECONDS);
            } catch (Exception e) {
                throw new IllegalStateException("second payment never reached its velocity read", e);
            }
        });

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        Callable<PaymentResult> submit = () -> {
            start.await();
            return paymentService.submitPayment(customer(SENDER_ID),
                    createPaymentRequest(SENDER_ID, RECIPIENT_ID, 4000.0));
        };
        Future<PaymentResult> first = pool.submit(submit);
        Future<PaymentResult> second = pool.submit(submit);
        start.countDown();

        List<PaymentResult> results = List.of(first.get(10, TimeUnit.SECONDS), second.get(10, TimeUnit.SECONDS));
        pool.shutdown();
        ledger.beforeVelocityRead(null);

        // best-effort limit: neither saw the other, so the 1h amount ceiling is exceeded unflagged
        for (PaymentResult result : results) {
            Transaction saved = ledger.transaction(result.transactionId());
            assertThat(saved.getDetails().getVelocityViolations()).isEmpty();
            assertThat(saved.getDetails().getVelocity().getCount1h()).isZero();
        }
        assertThat(ledger.balance(SENDER_ID)).isEqualTo(12000.0);
        assertThat(ledger.balance(RECIPIENT_ID)).isEqualTo(16000.0);
        assertThat(velocityCheckService.snapshot(SENDER_ID).getAmount1h()).isEqualTo(8000.0);
    }

    @Test
    void listByStatus_customer_isUnauthorized() {
        assertThatThrownBy(() -> paymentService.listByStatus(customer(SENDER_ID), TransactionStatus.BLOCKED, 10, null))
                .isInstanceOf(UnauthorizedOperationException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    void listQueries_limitBelowOne_isRejectedBeforeTheScan(int limit) {
        assertThatThrownBy(() -> paymentService.listByStatus(admin(), TransactionStatus.BLOCKED, limit, null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("limit must be at least 1");
        assertThatThrownBy(() -> paymentService.listBySender(customer(SENDER_ID), SENDER_ID, limit, null))
                .isInstanceOf(ValidationException.class);

        verify(transactionRepository, never()).findByStatus(any(), anyInt(), any());
        verify(transactionRepository, never()).findBySender(any(), anyInt(), any());
    }

    @Test
    void getTransaction_customerNotParty_isUnauthorized() {
        ledger.put(createTransaction("TXN-1", SENDER_ID, RECIPIENT_ID, 10.0, TransactionStatus.SETTLED,
                NOW.toEpochMilli()));

        assertThat(paymentService.getTransaction(customer(RECIPIENT_ID), "TXN-1").getAmount()).isEqualTo(10.0);
        assertThatThrownBy(() -> paymentService.getTransaction(customer("USR-0005"), "TXN-1"))
                .isInstanceOf(UnauthorizedOperationException.class);
    }
}
