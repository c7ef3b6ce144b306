package com.flagship.trade_finance.validation;

import com.flagship.trade_finance.error.ErrorKind;
import lombok.Value;

import java.math.BigInteger;

/**
 * Either a pass, possibly requiring an approve step for {@code approvalAmount},
 * or a rejection with its kind.
 */
@Value
public class ValidationResult {
    boolean ok;
    ErrorKind kind;
    String detail;
    boolean approvalRequired;
    BigInteger approvalAmount;

    public static ValidationResult pass() {
        return new ValidationResult(true, null, null, false, null);
    }

    public static ValidationResult passWithApproval(BigInteger amount) {
        return new ValidationResult(true, null, null, true, amount);
    }

    public static ValidationResult reject(ErrorKind kind, String detail) {
        return new ValidationResult(false, kind, detail, false, null);
    }
}
