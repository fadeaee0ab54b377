package com.bank.p2pfraud.model;

public enum CasePriority {
    HIGH,
    MEDIUM,
    LOW
}
