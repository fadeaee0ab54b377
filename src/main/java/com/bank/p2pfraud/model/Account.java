package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A customer, investigator or administrator account holding a monetary balance")
public class Account {

    @Schema(description = "Unique account identifier", example = "USR-0003")
    private String accountId;

    @Schema(description = "Display name", example = "John Customer")
    private String name;

    @Schema(description = "Login email, unique case-insensitively", example = "user@fraud-detect.local")
    private String email;

    @Schema(description = "Account role", example = "CUSTOMER")
    private AccountRole role;

    @Schema(description = "Approval status", example = "APPROVED")
    private AccountStatus status;

    @Schema(description = "Current balance in USD", example = "10000.00")
    private double balance;

    @Schema(description = "Creation timestamp in epoch milliseconds", example = "1739886764000")
    private long createdAt;

    public boolean isApproved() {
        return status == AccountStatus.APPROVED;
    }

    public String getDisplayName() {
        return (name != null && !name.isBlank()) ? name : email;
    }
}
