package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Investigator verdict on a case")
public record ResolveCaseRequest(
        @Schema(description = "SAFE or FRAUDULENT", example = "SAFE") CaseFinding finding,
        @Schema(description = "Investigation report, at least the configured minimum length") String report,
        @Schema(description = "Optional confidence hint 0-100", example = "85", nullable = true) Integer confidence) {}
