package com.bank.p2pfraud.service;

import com.bank.p2pfraud.exception.UnauthorizedOperationException;
import com.bank.p2pfraud.model.Transaction;
import com.bank.p2pfraud.model.TransactionStatus;
import com.bank.p2pfraud.model.TransactionType;
import com.bank.p2pfraud.model.VelocityCheckResult;
import com.bank.p2pfraud.model.VelocitySnapshot;
import com.bank.p2pfraud.repository.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.bank.p2pfraud.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class VelocityCheckServiceTest {

    private static final long NOW_MS = NOW.toEpochMilli();
    private static final long MINUTE = 60_000L;

    @Mock private TransactionRepository transactionRepository;
    @Mock private SettingsService settingsService;

    private VelocityCheckService velocityService;

    @BeforeEach
    void setUp() {
        lenient().when(settingsService.getSettings()).thenAnswer(inv -> defaultSettings());
        velocityService = new VelocityCheckService(transactionRepository, settingsService, fixedClock());
    }

    @Test
    void snapshot_splitsWindowsAndSkipsBlockedAndRejected() {
        when(transactionRepository.findBySenderSince(eq(SENDER_ID), eq(NOW_MS - 24 * 60 * MINUTE))).thenReturn(List.of(
                createTransaction("T1", SENDER_ID, "R1", 100.0, TransactionStatus.SETTLED, NOW_MS - 10 * MINUTE),
                createTransaction("T2", SENDER_ID, "R2", 200.0, TransactionStatus.FLAGGED, NOW_MS - 30 * MINUTE),
                createTransaction("T3", SENDER_ID, "R1", 400.0, TransactionStatus.SETTLED, NOW_MS - 5 * 60 * MINUTE),
                createTransaction("T4", SENDER_ID, "R3", 9000.0, TransactionStatus.BLOCKED, NOW_MS - 2 * MINUTE),
                createTransaction("T5", SENDER_ID, "R4", 800.0, TransactionStatus.REJECTED_FRAUDULENT, NOW_MS - 3 * MINUTE)));

        VelocitySnapshot snapshot = velocityService.snapshot(SENDER_ID);

        assertThat(snapshot.getAmount1h()).isEqualTo(300.0);
        assertThat(snapshot.getCount1h()).isEqualTo(2);
        assertThat(snapshot.getAmount24h()).isEqualTo(700.0);
        assertThat(snapshot.getCount24h()).isEqualTo(3);
        assertThat(snapshot.getUniqueRecipients24h()).isEqualTo(2);
    }

    @Test
    void snapshot_ignoresAdminAdjustments() {
        Transaction adjustment = createTransaction("T2", SENDER_ID, null, 5000.0, TransactionStatus.SETTLED,
                NOW_MS - 5 * MINUTE).toBuilder().type(TransactionType.ADMIN_ADJUSTMENT).build();
        when(transactionRepository.findBySenderSince(anyString(), anyLong())).thenReturn(List.of(
                createTransaction("T1", SENDER_ID, "R1", 100.0, TransactionStatus.SETTLED, NOW_MS - 10 * MINUTE),
                adjustment));

        VelocitySnapshot snapshot = velocityService.snapshot(SENDER_ID);

        assertThat(snapshot.getAmount1h()).isEqualTo(100.0);
        assertThat(snapshot.getCount24h()).isEqualTo(1);
    }

    @Test
    void check_candidateAmountPushesOverLimits_reportsViolations() {
        when(transactionRepository.findBySenderSince(anyString(), anyLong())).thenReturn(List.of(
                createTransaction("T1", SENDER_ID, "R1", 4500.0, TransactionStatus.SETTLED, NOW_MS - 10 * MINUTE),
                createTransaction("T2", SENDER_ID, "R1", 5000.0, TransactionStatus.SETTLED, NOW_MS - 3 * 60 * MINUTE)));

        VelocityCheckResult result = velocityService.check(SENDER_ID, 1000.0);

        assertThat(result.violations()).containsExactly(
                "1h amount limit exceeded: $5500.00",
                "24h amount limit exceeded: $10500.00");
        assertThat(result.hasViolations()).isTrue();
    }

    @Test
    void check_quietSender_hasNoViolations() {
        when(transactionRepository.findBySenderSince(anyString(), anyLong())).thenReturn(List.of());

        VelocityCheckResult result = velocityService.check(SENDER_ID, 50.0);

        assertThat(result.violations()).isEmpty();
        assertThat(result.snapshot().getCount24h()).isZero();
    }

    @Test
    void getVelocitySnapshot_customerReadingAnotherAccount_isUnauthorized() {
        assertThatThrownBy(() -> velocityService.getVelocitySnapshot(customer(SENDER_ID), RECIPIENT_ID))
                .isInstanceOf(UnauthorizedOperationException.class);
        verifyNoInteractions(transactionRepository);
    }

    @Test
    void getVelocitySnapshot_investigatorMayReadAnyAccount() {
        when(transactionRepository.findBySenderSince(anyString(), anyLong())).thenReturn(List.of());

        assertThat(velocityService.getVelocitySnapshot(investigator(), SENDER_ID).getAmount24h()).isZero();
    }
}
