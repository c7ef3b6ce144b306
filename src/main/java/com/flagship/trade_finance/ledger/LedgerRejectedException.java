package com.flagship.trade_finance.ledger;

import com.flagship.trade_finance.error.LedgerFailure;

/**
 * The ledger refused or reverted an operation. The raw failure is kept for
 * classification.
 */
public class LedgerRejectedException extends RuntimeException {

    private final LedgerFailure failure;

    public LedgerRejectedException(LedgerFailure failure) {
        super(failure.describe());
        this.failure = failure;
    }

    public LedgerRejectedException(LedgerFailure failure, Throwable cause) {
        super(failure.describe(), cause);
        this.failure = failure;
    }

    public LedgerFailure getFailure() {
        return failure;
    }
}
