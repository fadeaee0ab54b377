package com.bank.p2pfraud.service;

import com.aerospike.client.AerospikeException;
import com.aerospike.client.ResultCode;
import com.bank.p2pfraud.config.MetricsConfig;
import com.bank.p2pfraud.exception.UnauthorizedOperationException;
import com.bank.p2pfraud.exception.ValidationException;
import com.bank.p2pfraud.model.AuditLogEntry;
import com.bank.p2pfraud.repository.AuditLogRepository;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static com.bank.p2pfraud.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditLogServiceTest {

    @Mock private AuditLogRepository auditLogRepository;
    @Mock private MetricsConfig metricsConfig;

    private AuditLogService auditLogService;

    @BeforeEach
    void setUp() {
        Retry retry = Retry.of("auditLog-test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(Exception.class)
                .build());
        auditLogService = new AuditLogService(auditLogRepository, retry, metricsConfig, fixedClock());
    }

    @Test
    void record_transientFailure_isRetriedWithSameEntry() {
        doThrow(new AerospikeException(ResultCode.KEY_BUSY))
                .doNothing()
                .when(auditLogRepository).append(any(AuditLogEntry.class));

        auditLogService.record(ADMIN_ID, "assign_case", "case", "CASE-1", "investigator=USR-0002");

        ArgumentCaptor<AuditLogEntry> captor = ArgumentCaptor.forClass(AuditLogEntry.class);
        verify(auditLogRepository, times(2)).append(captor.capture());
        assertThat(captor.getAllValues().get(0).getEntryId()).isEqualTo(captor.getAllValues().get(1).getEntryId());
        assertThat(captor.getValue().getCreatedAt()).isEqualTo(NOW.toEpochMilli());
        verify(metricsConfig, never()).recordAuditFailure();
    }

    @Test
    void record_persistentFailure_givesUpQuietlyAfterMaxAttempts() {
        doThrow(new AerospikeException(ResultCode.KEY_BUSY)).when(auditLogRepository).append(any(AuditLogEntry.class));

        assertThatCode(() -> auditLogService.record(ADMIN_ID, "update_settings", "settings", "system", null))
                .doesNotThrowAnyException();

        verify(auditLogRepository, times(3)).append(any(AuditLogEntry.class));
        verify(metricsConfig).recordAuditFailure();
    }

    @Test
    void findRecent_admin_readsNewestEntries() {
        AuditLogEntry entry = AuditLogEntry.builder().entryId("AUD-1").action("override_approve").build();
        when(auditLogRepository.findRecent("transaction", "TXN-1", 20)).thenReturn(List.of(entry));

        assertThat(auditLogService.findRecent(admin(), "transaction", "TXN-1", 20)).containsExactly(entry);
    }

    @Test
    void findRecent_nonAdmin_isUnauthorized() {
        assertThatThrownBy(() -> auditLogService.findRecent(investigator(), null, null, 100))
                .isInstanceOf(UnauthorizedOperationException.class);
        verifyNoInteractions(auditLogRepository);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -5})
    void findRecent_limitBelowOne_isRejected(int limit) {
        assertThatThrownBy(() -> auditLogService.findRecent(admin(), null, null, limit))
                .isInstanceOf(ValidationException.class)
                .hasMessage("limit must be at least 1");
        verifyNoInteractions(auditLogRepository);
    }
}
