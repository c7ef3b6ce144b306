package com.flagship.trade_finance.validation;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Ledger balances of one account as read just before validation.
 * {@code allowance} is what the account has granted the shipment contract.
 */
@Value
@Builder
public class AccountSnapshot {
    String account;
    @Builder.Default
    BigInteger tokenBalance = BigInteger.ZERO;
    @Builder.Default
    BigInteger nativeBalance = BigInteger.ZERO;
    @Builder.Default
    BigInteger allowance = BigInteger.ZERO;
}
