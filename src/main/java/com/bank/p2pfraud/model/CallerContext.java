package com.bank.p2pfraud.model;

import com.bank.p2pfraud.exception.UnauthorizedOperationException;

import java.util.Arrays;

/**
 * Identity of the caller for one request, passed explicitly into every core operation.
 */
public record CallerContext(String callerId, AccountRole role) {

    public static CallerContext of(String callerId, AccountRole role) {
        return new CallerContext(callerId, role);
    }

    public boolean isAdmin() {
        return role == AccountRole.ADMIN;
    }

    public void requireRole(AccountRole... allowed) {
        if (Arrays.asList(allowed).contains(role)) {
            return;
        }
        throw new UnauthorizedOperationException(
                "Role " + role + " may not perform this operation (allowed: " + Arrays.toString(allowed) + ")");
    }
}
