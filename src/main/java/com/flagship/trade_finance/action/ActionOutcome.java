package com.flagship.trade_finance.action;

public enum ActionOutcome {
    /** Confirmed by the ledger. */
    CONFIRMED,
    /** Rejected locally or by the ledger; nothing to recheck. */
    FAILED,
    /** Submitted but not confirmed in time; may still confirm. Recheck on next refresh. */
    INDETERMINATE
}
