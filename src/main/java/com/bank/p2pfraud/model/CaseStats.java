package com.bank.p2pfraud.model;

import java.util.Map;

public record CaseStats(Map<CaseStatus, Long> byStatus, Map<CaseFinding, Long> byFinding) {}
