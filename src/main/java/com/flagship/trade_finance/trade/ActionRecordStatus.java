package com.flagship.trade_finance.trade;

import com.flagship.trade_finance.action.ActionOutcome;

/**
 * Persisted state of an orchestrated request.
 *
 * PENDING is written before the coordinator runs and replaced by the outcome
 * once it returns. INDETERMINATE records may later move to CONFIRMED or FAILED
 * when the submission is looked up again.
 */
public enum ActionRecordStatus {
    PENDING,
    CONFIRMED,
    FAILED,
    INDETERMINATE;

    public static ActionRecordStatus from(ActionOutcome outcome) {
        return switch (outcome) {
            case CONFIRMED -> CONFIRMED;
            case FAILED -> FAILED;
            case INDETERMINATE -> INDETERMINATE;
        };
    }

    public boolean isFinal() {
        return this == CONFIRMED || this == FAILED;
    }
}
