package com.bank.p2pfraud.service;

import com.bank.p2pfraud.config.MetricsConfig;
import com.bank.p2pfraud.exception.AuditWriteFailedException;
import com.bank.p2pfraud.exception.ValidationException;
import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.AuditLogEntry;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.repository.AuditLogRepository;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Best-effort audit trail. Writes are retried with backoff and, if they still
 * fail, logged and counted. Callers never see an audit failure.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    public static final String ENTITY_TRANSACTION = "transaction";
    public static final String ENTITY_CASE = "case";
    public static final String ENTITY_USER = "user";
    public static final String ENTITY_SETTINGS = "settings";

    private final AuditLogRepository auditLogRepository;
    private final Retry auditLogRetry;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository,
                           @Qualifier("auditLogRetry") Retry auditLogRetry,
                           MetricsConfig metricsConfig,
                           Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.auditLogRetry = auditLogRetry;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Async
    public void record(String actorId, String action, String entityType, String entityId, String details) {
        // id fixed before the first attempt so a retried write lands on the same record
        AuditLogEntry entry = AuditLogEntry.builder()
                .entryId("AUD-" + UUID.randomUUID())
                .actorId(actorId)
                .action(action)
                .entityType(entityType)
                .entityId(entityId)
                .details(details)
                .createdAt(clock.millis())
                .build();

        try {
            Retry.decorateRunnable(auditLogRetry, () -> auditLogRepository.append(entry)).run();
        } catch (Exception e) {
            AuditWriteFailedException failure = new AuditWriteFailedException(
                    String.format("Audit write for %s on %s %s gave up after %d attempts",
                            action, entityType, entityId, auditLogRetry.getRetryConfig().getMaxAttempts()), e);
            metricsConfig.recordAuditFailure();
            log.warn(failure.getMessage(), failure);
        }
    }

    /**
     * Admin only. Newest first, optionally filtered by entity type and id.
     */
    public List<AuditLogEntry> findRecent(CallerContext caller, String entityType, String entityId, int limit) {
        caller.requireRole(AccountRole.ADMIN);
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1");
        }
        return auditLogRepository.findRecent(entityType, entityId, limit);
    }
}
