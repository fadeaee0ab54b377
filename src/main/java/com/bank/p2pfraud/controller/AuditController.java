package com.bank.p2pfraud.controller;

import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.AuditLogEntry;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.service.AuditLogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit", description = "Audit trail of payments, case actions, overrides and policy changes")
public class AuditController {

    private final AuditLogService auditLogService;

    public AuditController(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    @Operation(summary = "List recent audit entries",
            description = "Admin only. Newest first, optionally filtered by entity type and id.")
    @GetMapping
    public ResponseEntity<List<AuditLogEntry>> findRecent(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @Parameter(description = "Entity type", example = "transaction")
            @RequestParam(required = false) String entityType,
            @Parameter(description = "Entity ID", example = "TXN-6f1c2a9e")
            @RequestParam(required = false) String entityId,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(auditLogService.findRecent(
                CallerContext.of(callerId, callerRole), entityType, entityId, limit));
    }
}
