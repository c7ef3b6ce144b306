package com.flagship.trade_finance.error;

import lombok.Getter;

/**
 * Thrown when an action is refused by a local rule, before or instead of a
 * ledger submission.
 */
@Getter
public class ActionRejectedException extends RuntimeException {

    private final ErrorKind kind;

    public ActionRejectedException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ActionRejectedException(ErrorKind kind) {
        this(kind, kind.getDefaultMessage());
    }
}
