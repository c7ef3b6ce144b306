package com.flagship.trade_finance.ledger;

import lombok.Value;

/**
 * Opaque reference to a submitted operation (a transaction hash on most ledgers).
 */
@Value
public class SubmissionRef {
    String value;

    public static SubmissionRef of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Submission reference cannot be blank");
        }
        return new SubmissionRef(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
