package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Error body returned for every rejected request")
public record ApiError(
        @Schema(description = "HTTP status code", example = "409") int status,
        @Schema(description = "HTTP reason phrase", example = "Conflict") String error,
        @Schema(description = "Human-readable failure", example = "Case CASE-1a2b3c4d is already resolved") String message,
        @Schema(description = "Request path", example = "/api/v1/cases/CASE-1a2b3c4d/resolve") String path,
        @Schema(description = "Epoch milliseconds", example = "1739886764000") long timestamp) {}
