package com.flagship.trade_finance.shipment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class TokenAmountsTest {

    private final TokenAmounts tokens = new TokenAmounts(18);

    @Test
    @DisplayName("Token amounts convert to base units exactly")
    void toBaseUnits() {
        assertEquals(new BigInteger("1500000000000000000"), tokens.toBaseUnits(new BigDecimal("1.5")));
        assertEquals(new BigDecimal("1.5"), tokens.toTokens(new BigInteger("1500000000000000000")));
        assertNull(tokens.toBaseUnits(null));
    }

    @Test
    @DisplayName("More precision than the token has is refused")
    void tooPrecise() {
        assertThrows(IllegalArgumentException.class,
                () -> tokens.toBaseUnits(new BigDecimal("0.0000000000000000001")));
    }

    @Test
    @DisplayName("Query-service strings parse with blank as zero")
    void parseTokens() {
        assertEquals(BigInteger.ZERO, tokens.parseTokens(" "));
        assertEquals(BigInteger.TEN.pow(21), tokens.parseTokens("1000"));
    }
}
