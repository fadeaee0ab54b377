package com.bank.p2pfraud.controller;

import com.bank.p2pfraud.model.AccountRole;
import com.bank.p2pfraud.model.CallerContext;
import com.bank.p2pfraud.model.PagedResponse;
import com.bank.p2pfraud.model.PaymentRequest;
import com.bank.p2pfraud.model.PaymentResult;
import com.bank.p2pfraud.model.Transaction;
import com.bank.p2pfraud.model.TransactionStatus;
import com.bank.p2pfraud.model.VelocitySnapshot;
import com.bank.p2pfraud.service.PaymentService;
import com.bank.p2pfraud.service.VelocityCheckService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/payments")
@Tag(name = "Payments", description = "Submit peer-to-peer payments for risk decisioning and query payment history")
public class PaymentController {

    private final PaymentService paymentService;
    private final VelocityCheckService velocityCheckService;

    public PaymentController(PaymentService paymentService, VelocityCheckService velocityCheckService) {
        this.paymentService = paymentService;
        this.velocityCheckService = velocityCheckService;
    }

    @Operation(summary = "Submit a payment",
            description = "Scores the payment with the fraud model and the risk rules, then settles, flags or blocks it. " +
                    "Flagged and blocked payments open an investigation case. Fails with 422 when the sender " +
                    "cannot cover the amount; nothing is written in that case.")
    @PostMapping
    public ResponseEntity<PaymentResult> submitPayment(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @RequestBody PaymentRequest request) {
        PaymentResult result = paymentService.submitPayment(CallerContext.of(callerId, callerRole), request);
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Get a payment by ID",
            description = "Customers may only read payments they sent or received.")
    @GetMapping("/{txnId}")
    public ResponseEntity<Transaction> getPayment(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @Parameter(description = "Transaction ID", example = "TXN-6f1c2a9e")
            @PathVariable String txnId) {
        return ResponseEntity.ok(paymentService.getTransaction(CallerContext.of(callerId, callerRole), txnId));
    }

    @Operation(summary = "List payments by status",
            description = "Investigators and admins only. Newest first, cursor-paginated on createdAt.")
    @GetMapping
    public ResponseEntity<PagedResponse<Transaction>> listByStatus(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @Parameter(description = "Payment status", example = "BLOCKED")
            @RequestParam TransactionStatus status,
            @Parameter(description = "Max number of payments to return", example = "50")
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "Cursor: return records created before this value")
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(paymentService.listByStatus(
                CallerContext.of(callerId, callerRole), status, limit, before));
    }

    @Operation(summary = "List payments sent by an account",
            description = "Customers may only list their own payments. Newest first, cursor-paginated on createdAt.")
    @GetMapping("/sender/{senderId}")
    public ResponseEntity<PagedResponse<Transaction>> listBySender(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @Parameter(description = "Sender account ID", example = "USR-0003")
            @PathVariable String senderId,
            @Parameter(description = "Max number of payments to return", example = "50")
            @RequestParam(defaultValue = "50") int limit,
            @Parameter(description = "Cursor: return records created before this value")
            @RequestParam(required = false) Long before) {
        return ResponseEntity.ok(paymentService.listBySender(
                CallerContext.of(callerId, callerRole), senderId, limit, before));
    }

    @Operation(summary = "Get velocity snapshot",
            description = "Rolling 1h / 24h amounts and counts for a sender, excluding rejected and blocked payments.")
    @GetMapping("/velocity/{userId}")
    public ResponseEntity<VelocitySnapshot> getVelocity(
            @RequestHeader("X-Caller-Id") String callerId,
            @RequestHeader("X-Caller-Role") AccountRole callerRole,
            @Parameter(description = "Account ID", example = "USR-0003")
            @PathVariable String userId) {
        return ResponseEntity.ok(velocityCheckService.getVelocitySnapshot(
                CallerContext.of(callerId, callerRole), userId));
    }
}
