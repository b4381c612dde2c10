package com.snuffles.ledgerpnl.ledger;

public class LedgerReadException extends RuntimeException {

    public LedgerReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
