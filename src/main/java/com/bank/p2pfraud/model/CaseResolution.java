package com.bank.p2pfraud.model;

public record CaseResolution(InvestigationCase investigationCase,
                             TransactionStatus transactionStatus,
                             boolean balancesChanged) {}
