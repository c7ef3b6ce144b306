package com.flagship.trade_finance.offer;

import lombok.Value;

import java.math.BigInteger;

/**
 * An investor's proposal to fund a shipment.
 *
 * Offer ids are scoped to the shipment. {@code accepted} only moves from
 * false to true.
 */
@Value
public class FundingOffer {
    String shipmentId;
    long offerId;
    String investor;
    BigInteger amount;
    int interestRateBps;
    boolean accepted;

    public static FundingOffer open(String shipmentId, long offerId, String investor,
                                    BigInteger amount, int interestRateBps) {
        return new FundingOffer(shipmentId, offerId, investor, amount, interestRateBps, false);
    }

    public BigInteger claimTokens() {
        return ClaimTokenMath.claimTokens(amount, interestRateBps);
    }

    /**
     * @throws IllegalStateException if already accepted
     */
    public FundingOffer accept() {
        if (accepted) {
            throw new IllegalStateException(
                    String.format("Offer %d on shipment %s is already accepted", offerId, shipmentId));
        }
        return new FundingOffer(shipmentId, offerId, investor, amount, interestRateBps, true);
    }
}
