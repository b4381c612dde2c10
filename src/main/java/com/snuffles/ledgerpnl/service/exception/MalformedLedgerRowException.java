package com.snuffles.ledgerpnl.service.exception;

public class MalformedLedgerRowException extends RuntimeException {

    public MalformedLedgerRowException(String message) {
        super(message);
    }
}
