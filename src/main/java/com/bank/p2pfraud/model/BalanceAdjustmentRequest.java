package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Administrator change to one account's balance")
public record BalanceAdjustmentRequest(
        @Schema(description = "ADD, DEDUCT (floored at zero) or SET", example = "ADD") BalanceAdjustmentType type,
        @Schema(description = "Amount to add or deduct, or the new balance for SET", example = "100.00") double amount,
        @Schema(description = "Why the balance is being changed", example = "Goodwill credit") String reason) {}
