package com.bank.p2pfraud.model;

public enum AccountStatus {
    PENDING,
    APPROVED,
    REJECTED
}
