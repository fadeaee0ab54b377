package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of a balance adjustment")
public record BalanceAdjustmentResult(
        @Schema(description = "Adjusted account", example = "USR-0003") String accountId,
        @Schema(description = "ADMIN_ADJUSTMENT transaction recording the change", example = "TXN-1b2c3d4e") String txnId,
        @Schema(description = "Adjustment applied", example = "DEDUCT") BalanceAdjustmentType type,
        @Schema(description = "Balance before the adjustment", example = "10000.00") double previousBalance,
        @Schema(description = "Balance after the adjustment", example = "9900.00") double newBalance) {}
