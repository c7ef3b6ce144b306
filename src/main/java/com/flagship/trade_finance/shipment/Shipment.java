package com.flagship.trade_finance.shipment;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Shipment as mirrored from the ledger.
 *
 * Identity is the BoL hash. Monetary fields are ledger base units and never
 * decrease once set. Stage timestamps are filled strictly in the order
 * minted, fundingEnabled, arrived, paid, settled.
 */
@Value
@Builder(toBuilder = true)
public class Shipment {
    String bolHash;
    String contractAddress;
    String seller;
    String buyer;
    String carrier;
    String blNumber;
    String documentUrl;

    @Builder.Default
    BigInteger declaredValue = BigInteger.ZERO;
    @Builder.Default
    BigInteger totalFunded = BigInteger.ZERO;
    @Builder.Default
    BigInteger totalPaid = BigInteger.ZERO;
    @Builder.Default
    BigInteger totalRepaid = BigInteger.ZERO;

    Instant mintedAt;
    Instant fundingEnabledAt;
    Instant arrivedAt;
    Instant paidAt;
    Instant settledAt;

    public BigInteger remainingCapacity() {
        return declaredValue.subtract(totalFunded).max(BigInteger.ZERO);
    }

    public boolean isSeller(String account) {
        return sameAccount(seller, account);
    }

    public boolean isBuyer(String account) {
        return sameAccount(buyer, account);
    }

    public boolean isCarrier(String account) {
        return sameAccount(carrier, account);
    }

    /**
     * Ledger addresses compare case-insensitively.
     */
    public static boolean sameAccount(String a, String b) {
        return a != null && b != null && a.equalsIgnoreCase(b);
    }
}
