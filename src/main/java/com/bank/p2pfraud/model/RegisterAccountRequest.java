package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "New account awaiting approval")
public record RegisterAccountRequest(
        @Schema(description = "Display name", example = "Jane Smith") String name,
        @Schema(description = "Login email, unique case-insensitively", example = "jane@fraud-detect.local") String email,
        @Schema(description = "Account role", example = "CUSTOMER") AccountRole role) {}
