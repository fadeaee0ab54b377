package com.bank.p2pfraud.model;

public record OverrideResult(String txnId, TransactionStatus status, boolean fundsMoved) {}
