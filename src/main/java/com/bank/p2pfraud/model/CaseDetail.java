package com.bank.p2pfraud.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything an investigator sees for one case. The relationship signals are
 * display-only and never feed back into the risk score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaseDetail {
    private InvestigationCase investigationCase;
    private Transaction transaction;
    private Account sender;
    private Account recipient;
    private boolean firstInteraction;
    private long senderPriorFlaggedCount;
}
