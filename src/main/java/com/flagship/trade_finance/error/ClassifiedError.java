package com.flagship.trade_finance.error;

import lombok.Value;

/**
 * Result of classifying a ledger rejection.
 *
 * {@code message} is the human-readable primary message; {@code diagnostic}
 * keeps the untouched ledger text for logs and support.
 */
@Value
public class ClassifiedError {
    ErrorKind kind;
    String message;
    String diagnostic;

    public static ClassifiedError of(ErrorKind kind, String diagnostic) {
        return new ClassifiedError(kind, kind.getDefaultMessage(), diagnostic);
    }
}
