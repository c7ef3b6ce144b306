package com.flagship.trade_finance.shipment;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Converts between human token units (REST, query service) and ledger base units.
 */
@Component
public class TokenAmounts {

    private final int decimals;

    public TokenAmounts(@Value("${ledger.token-decimals:18}") int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("Token decimals cannot be negative");
        }
        this.decimals = decimals;
    }

    /**
     * @throws IllegalArgumentException if the amount has more precision than the token
     */
    public BigInteger toBaseUnits(BigDecimal amount) {
        if (amount == null) {
            return null;
        }
        try {
            return amount.movePointRight(decimals).toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(
                    String.format("Amount %s has more than %d decimal places", amount.toPlainString(), decimals));
        }
    }

    public BigDecimal toTokens(BigInteger baseUnits) {
        if (baseUnits == null) {
            return null;
        }
        return new BigDecimal(baseUnits).movePointLeft(decimals).stripTrailingZeros();
    }

    /**
     * Parses a decimal string as returned by the query service. Blank means zero.
     */
    public BigInteger parseTokens(String tokens) {
        if (tokens == null || tokens.isBlank()) {
            return BigInteger.ZERO;
        }
        return new BigDecimal(tokens.trim()).movePointRight(decimals).toBigInteger();
    }

    public int getDecimals() {
        return decimals;
    }
}
