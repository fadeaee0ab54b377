package com.bank.p2pfraud.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntry {
    private String entryId;
    private String actorId;
    private String action;          // e.g. "process_payment", "assign_case"
    private String entityType;      // "transaction", "case", "user", "settings"
    private String entityId;
    private String details;
    private long createdAt;
}
