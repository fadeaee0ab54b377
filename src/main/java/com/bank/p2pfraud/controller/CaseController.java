package com.bank.p2pfraud.controller;

import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.AssignCaseRequest;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.model.CaseDetail;
import com.bank.p2pfraud.model.CaseResolution;
import com.bank.p2pfraud.model.CaseStats;
import com.bank.p2pfraud.model.CaseStatus;
import com.bank.p2pfraud.model.InvestigationCase;
import com.bank.p2pfraud.model.ResolveCaseRequest;
import com.bank.p2pfraud.service.CaseManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/cases")
@Tag(name = "Cases", description = "Investigation workflow for flagged and blocked payments")
public class CaseController {

    private final CaseManagementService caseManagementService;

    public CaseController(CaseManagementService caseManagementService) {
        this.caseManagementService = caseManagementService;
    }

    @GetMapping("/investigator/{investigatorId}")
    @Operation(summary = "List cases for an investigator",
               description = "Ordered by priority, then oldest first. Investigators may only list their own cases.")
    public ResponseEntity<List<InvestigationCase>> listForInvestigator(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @PathVariable String investigatorId,
            @RequestParam(required = false) CaseStatus status) {
        return ResponseEntity.ok(caseManagementService.listCasesForInvestigator(
                CallerContext.of(callerId, callerRole), investigatorId, status));
    }

    @GetMapping("/unassigned")
    @Operation(summary = "List unassigned cases", description = "Admin only.")
    public ResponseEntity<List<InvestigationCase>> listUnassigned(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole) {
        return ResponseEntity.ok(caseManagementService.listUnassigned(CallerContext.of(callerId, callerRole)));
    }

    @GetMapping("/{caseId}")
    @Operation(summary = "Get case detail",
               description = "Case, transaction, both parties and display-only relationship signals")
    public ResponseEntity<CaseDetail> getCaseDetail(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @Parameter(description = "Case ID", example = "CASE-1a2b3c4d")
            @PathVariable String caseId) {
        return ResponseEntity.ok(caseManagementService.getCaseDetail(CallerContext.of(callerId, callerRole), caseId));
    }

    @PostMapping("/{caseId}/assign")
    @Operation(summary = "Assign a case", description = "Admin only. Target must be an approved investigator.")
    public ResponseEntity<InvestigationCase> assignCase(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @PathVariable String caseId,
            @RequestBody AssignCaseRequest body) {
        return ResponseEntity.ok(caseManagementService.assignCase(
                CallerContext.of(callerId, callerRole), caseId, body.investigatorId()));
    }

    @PostMapping("/{caseId}/resolve")
    @Operation(summary = "Resolve a case",
               description = "Records the finding and applies its effect on the payment and balances. " +
                       "A second resolution fails with 409.")
    public ResponseEntity<CaseResolution> resolveCase(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @PathVariable String caseId,
            @RequestBody ResolveCaseRequest body) {
        return ResponseEntity.ok(caseManagementService.resolveCase(CallerContext.of(callerId, callerRole),
                caseId, body.finding(), body.report(), body.confidence()));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get case statistics", description = "Counts by status and by finding")
    public ResponseEntity<CaseStats> getStats(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole) {
        return ResponseEntity.ok(caseManagementService.getStats(CallerContext.of(callerId, callerRole)));
    }
}
