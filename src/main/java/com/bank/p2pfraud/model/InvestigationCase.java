package com.bank.p2pfraud.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Investigation case for a flagged or blocked payment")
public class InvestigationCase {

    @Schema(description = "Unique case identifier", example = "CASE-1a2b3c4d")
    private String caseId;

    @Schema(description = "Transaction under investigation", example = "TXN-6f1c2a9e")
    private String txnId;

    @Schema(description = "Assigned investigator. Null while queued.", nullable = true)
    private String assignedTo;

    @Schema(description = "Case status", example = "IN_REVIEW")
    private CaseStatus status;

    @Schema(description = "Investigator verdict", example = "NONE")
    private CaseFinding finding;

    @Schema(description = "Free-text investigation report")
    private String report;

    @Schema(description = "Investigator confidence hint, 0-100", nullable = true)
    private Integer confidence;

    @Schema(description = "Priority derived from the risk tier at creation", example = "HIGH")
    private CasePriority priority;

    @Schema(description = "Creation timestamp in epoch milliseconds")
    private long createdAt;

    @Schema(description = "Last update timestamp in epoch milliseconds")
    private long updatedAt;

    // Aerospike record generation, used for compare-and-swap updates
    @JsonIgnore
    private int generation;

    @JsonIgnore
    public boolean isResolved() {
        return status == CaseStatus.RESOLVED;
    }
}
