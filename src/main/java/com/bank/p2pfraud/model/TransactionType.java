package com.bank.p2pfraud.model;

/**
 * PAYMENT moves funds between two accounts; ADMIN_ADJUSTMENT changes one
 * account's balance and has no recipient.
 */
public enum TransactionType {
    PAYMENT,
    ADMIN_ADJUSTMENT
}
