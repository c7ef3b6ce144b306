package com.flagship.trade_finance.offer;

import java.math.BigInteger;

/**
 * Claim-token arithmetic in integer basis points.
 */
public final class ClaimTokenMath {

    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private ClaimTokenMath() {
    }

    /**
     * amount + amount * bps / 10000, truncating toward zero.
     */
    public static BigInteger claimTokens(BigInteger amount, int interestRateBps) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Amount must be non-negative");
        }
        if (interestRateBps < 0) {
            throw new IllegalArgumentException("Interest rate cannot be negative");
        }
        BigInteger interest = amount.multiply(BigInteger.valueOf(interestRateBps)).divide(BPS_DENOMINATOR);
        return amount.add(interest);
    }
}
