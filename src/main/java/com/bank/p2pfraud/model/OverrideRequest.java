package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Administrator decision on a blocked payment")
public record OverrideRequest(
        @Schema(description = "true releases the funds, false rejects the payment as fraudulent", example = "true")
        boolean approve) {}
