package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A peer-to-peer payment and its risk outcome")
public class Transaction {

    @Schema(description = "Unique transaction identifier", example = "TXN-6f1c2a9e")
    private String txnId;

    @Schema(description = "PAYMENT or ADMIN_ADJUSTMENT", example = "PAYMENT")
    @Builder.Default
    private TransactionType type = TransactionType.PAYMENT;

    @Schema(description = "Sending account; the adjusted account for an ADMIN_ADJUSTMENT", example = "USR-0003")
    private String senderId;

    @Schema(description = "Receiving account. Null for internal adjustments.", example = "USR-0004", nullable = true)
    private String recipientId;

    @Schema(description = "Payment amount, always positive", example = "50.00")
    private double amount;

    @Schema(description = "ISO currency code", example = "USD")
    private String currency;

    @Schema(description = "Free-text payment description", example = "Dinner split")
    private String description;

    @Schema(description = "Originating IP address captured at submission", example = "192.168.1.1")
    private String ipAddress;

    @Schema(description = "Device signature (user agent) captured at submission")
    private String deviceSignature;

    @Schema(description = "Declared location captured at submission", example = "New York")
    private String location;

    @Schema(description = "Lifecycle status", example = "SETTLED")
    private TransactionStatus status;

    @Schema(description = "Final risk score in [0,1]", example = "0.12", nullable = true)
    private Double riskScore;

    @Schema(description = "Structured risk details recorded at decision time")
    private TransactionDetails details;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    private long createdAt;
}
