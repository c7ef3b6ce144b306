package com.flagship.trade_finance.error;

import lombok.Value;

/**
 * Raw rejection signal as reported by the ledger: an opaque failure code
 * (error code or custom-error selector) and/or a free-text reason.
 * Either part may be null.
 */
@Value
public class LedgerFailure {
    String code;
    String reason;

    public static LedgerFailure of(String code, String reason) {
        return new LedgerFailure(code, reason);
    }

    public static LedgerFailure ofReason(String reason) {
        return new LedgerFailure(null, reason);
    }

    public static LedgerFailure ofCode(String code) {
        return new LedgerFailure(code, null);
    }

    /**
     * Single-line rendering used as diagnostic detail.
     */
    public String describe() {
        if (code == null) {
            return reason != null ? reason : "";
        }
        return reason == null ? "[" + code + "]" : "[" + code + "] " + reason;
    }
}
