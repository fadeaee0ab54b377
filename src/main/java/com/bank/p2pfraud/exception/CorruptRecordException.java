package com.bank.p2pfraud.exception;

/**
 * A stored record could not be read back. Raised on write paths so the record
 * is never rewritten from a partial read.
 */
public class CorruptRecordException extends FraudWorkflowException {

    public CorruptRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
