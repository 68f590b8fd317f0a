package com.certledger.errors;

/**
 * Ledger state could not be written; the in-memory mutation was rolled back.
 */
public class LedgerPersistenceException extends RuntimeException {

    public LedgerPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
