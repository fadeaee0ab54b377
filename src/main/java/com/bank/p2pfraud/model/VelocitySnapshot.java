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
@Schema(description = "Rolling-window usage of a sender, excluding rejected and blocked payments")
public class VelocitySnapshot {

    @Schema(description = "Amount sent in the last hour", example = "120.00")
    private double amount1h;

    @Schema(description = "Amount sent in the last 24 hours", example = "860.00")
    private double amount24h;

    @Schema(description = "Payments sent in the last hour", example = "2")
    private int count1h;

    @Schema(description = "Payments sent in the last 24 hours", example = "7")
    private int count24h;

    @Schema(description = "Distinct recipients in the last 24 hours", example = "3")
    private int uniqueRecipients24h;

    public static VelocitySnapshot empty() {
        return new VelocitySnapshot(0.0, 0.0, 0, 0, 0);
    }
}
