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
@Schema(description = "A proposed payment plus the context captured by the submitting client")
public class PaymentRequest {

    @Schema(description = "Sending account", example = "USR-0003")
    private String senderId;

    @Schema(description = "Receiving account", example = "USR-0004")
    private String recipientId;

    @Schema(description = "Amount in USD, must be positive", example = "50.00")
    private double amount;

    @Schema(description = "Payment description", example = "Dinner split")
    private String description;

    @Schema(description = "Originating IP address", example = "192.168.1.1")
    private String ipAddress;

    @Schema(description = "Device signature / user agent",
            example = "Mozilla/5.0 (iPhone; CPU iPhone OS 14_7_1 like Mac OS X)")
    private String deviceSignature;

    @Schema(description = "Declared location", example = "New York")
    private String location;

    @Schema(description = "Failed authentication attempts before this payment", example = "0")
    private int failedAttempts;

    @Schema(description = "Screen resolution reported by the client", example = "1920x1080")
    private String screenResolution;

    @Schema(description = "Time zone reported by the client", example = "America/New_York")
    private String timezone;
}
