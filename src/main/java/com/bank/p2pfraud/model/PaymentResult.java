package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Outcome of a submitted payment")
public record PaymentResult(
        @Schema(description = "Created transaction", example = "TXN-6f1c2a9e") String transactionId,
        @Schema(description = "Decision outcome", example = "SETTLED") PaymentOutcome outcome,
        @Schema(description = "Final risk score in [0,1]", example = "0.12") double finalScore,
        @Schema(description = "Risk factors in evaluation order") List<String> riskFactors,
        @Schema(description = "Recipient display name", example = "Jane Smith") String recipientDisplayName) {}
