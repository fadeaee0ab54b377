package com.bank.p2pfraud.model;

/**
 * Rule types in evaluation order. The ordinal order is the order in which
 * risk factors are reported and must not be rearranged.
 */
public enum RuleType {
    TRANSACTION_AMOUNT,
    ROUND_AMOUNT,
    MICRO_TRANSACTION,
    HIGH_RISK_LOCATION,
    SUSPICIOUS_DEVICE,
    FAILED_AUTHENTICATION,
    VELOCITY_COUNT,
    VELOCITY_AMOUNT,
    AMOUNT_SPIKE,
    ACCOUNT_AGE,
    UNUSUAL_HOUR,
    WEEKEND
}
