package com.flagship.trade_finance.ledger;

/**
 * The ledger gateway could not be reached or answered unexpectedly.
 * Whether a pending operation landed is unknown.
 */
public class LedgerUnavailableException extends RuntimeException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
