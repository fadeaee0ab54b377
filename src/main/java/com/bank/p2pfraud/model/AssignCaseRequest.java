package com.bank.p2pfraud.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Assignment of a case to an investigator")
public record AssignCaseRequest(
        @Schema(description = "Approved investigator account", example = "USR-0002") String investigatorId) {}
