package com.bank.p2pfraud.controller;

import com.bank.p2pfraud.model.Account;
import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.BalanceAdjustmentRequest;
import com.bank.p2pfraud.model.BalanceAdjustmentResult;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.model.OverrideRequest;
import com.bank.p2pfraud.model.OverrideResult;
import com.bank.p2pfraud.model.RegisterAccountRequest;
import com.bank.p2pfraud.service.AccountService;
import com.bank.p2pfraud.service.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "Admin", description = "Blocked-payment overrides, balance adjustments and account administration")
public class AdminController {

    private final LedgerService ledgerService;
    private final AccountService accountService;

    public AdminController(LedgerService ledgerService, AccountService accountService) {
        this.ledgerService = ledgerService;
        this.accountService = accountService;
    }

    @Operation(summary = "Override a blocked payment",
            description = "approve=true moves the funds if the sender can still cover them; approve=false rejects " +
                    "the payment as fraudulent. The linked open case is closed in the same unit of work.")
    @PostMapping("/payments/{txnId}/override")
    public ResponseEntity<OverrideResult> override(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @Parameter(description = "Blocked transaction ID", example = "TXN-6f1c2a9e")
            @PathVariable String txnId,
            @RequestBody OverrideRequest body) {
        return ResponseEntity.ok(ledgerService.adminOverride(
                CallerContext.of(callerId, callerRole), txnId, body.approve()));
    }

    @Operation(summary = "Register an account", description = "Creates a PENDING account with zero balance.")
    @PostMapping("/accounts")
    public ResponseEntity<Account> register(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @RequestBody RegisterAccountRequest body) {
        Account created = accountService.register(CallerContext.of(callerId, callerRole),
                body.name(), body.email(), body.role());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "List accounts awaiting approval")
    @GetMapping("/accounts/pending")
    public ResponseEntity<List<Account>> listPending(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole) {
        return ResponseEntity.ok(accountService.listPending(CallerContext.of(callerId, callerRole)));
    }

    @Operation(summary = "Approve an account", description = "Grants the configured default balance.")
    @PostMapping("/accounts/{accountId}/approve")
    public ResponseEntity<Account> approve(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @PathVariable String accountId) {
        return ResponseEntity.ok(accountService.approve(CallerContext.of(callerId, callerRole), accountId));
    }

    @Operation(summary = "Adjust an account balance",
            description = "ADD, DEDUCT (floored at zero) or SET a customer balance. The change is recorded as an " +
                    "ADMIN_ADJUSTMENT transaction with no recipient.")
    @PostMapping("/accounts/{accountId}/balance")
    public ResponseEntity<BalanceAdjustmentResult> adjustBalance(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @PathVariable String accountId,
            @RequestBody BalanceAdjustmentRequest body) {
        return ResponseEntity.ok(ledgerService.adjustBalance(CallerContext.of(callerId, callerRole),
                accountId, body.type(), body.amount(), body.reason()));
    }

    @Operation(summary = "Reject an account")
    @PostMapping("/accounts/{accountId}/reject")
    public ResponseEntity<Account> reject(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @PathVariable String accountId) {
        return ResponseEntity.ok(accountService.reject(CallerContext.of(callerId, callerRole), accountId));
    }
}
