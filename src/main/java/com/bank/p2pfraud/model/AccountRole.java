package com.bank.p2pfraud.model;

public enum AccountRole {
    CUSTOMER,
    INVESTIGATOR,
    ADMIN
}
