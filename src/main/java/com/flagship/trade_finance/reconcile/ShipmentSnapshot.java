package com.flagship.trade_finance.reconcile;

import com.flagship.trade_finance.lifecycle.LifecycleStateMachine;
import com.flagship.trade_finance.offer.FundingOffer;
import com.flagship.trade_finance.offer.OfferBook;
import com.flagship.trade_finance.shipment.Shipment;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable cached view of one shipment: the shipment itself, its offers and
 * the claim-token balances of known holders.
 *
 * A provisional snapshot stands in for a shipment the query service has not
 * indexed yet. It is only used for list presence and is replaced as soon as an
 * authoritative read exists.
 */
@Value
@Builder(toBuilder = true)
public class ShipmentSnapshot {
    Shipment shipment;
    @Builder.Default
    List<FundingOffer> offers = List.of();
    @Builder.Default
    Map<String, BigInteger> claimTokenBalances = Map.of();
    boolean provisional;
    Instant refreshedAt;

    public static ShipmentSnapshot provisional(Shipment shipment) {
        return ShipmentSnapshot.builder()
                .shipment(shipment)
                .provisional(true)
                .refreshedAt(Instant.now())
                .build();
    }

    public String getShipmentId() {
        return shipment.getBolHash();
    }

    public BigInteger claimTokenBalance(String holder) {
        if (holder == null) {
            return BigInteger.ZERO;
        }
        return claimTokenBalances.getOrDefault(holder.toLowerCase(Locale.ROOT), BigInteger.ZERO);
    }

    /**
     * Opens a working copy for applying an action.
     */
    public OfferBook toOfferBook(LifecycleStateMachine lifecycle) {
        return new OfferBook(lifecycle, shipment, offers, claimTokenBalances);
    }

    /**
     * Snapshot reflecting the state of a working copy after an action.
     */
    public ShipmentSnapshot withOfferBook(OfferBook book) {
        return toBuilder()
                .shipment(book.shipment())
                .offers(List.copyOf(book.offers()))
                .claimTokenBalances(Map.copyOf(book.claimTokenBalances()))
                .build();
    }

    /**
     * Equality ignoring {@code refreshedAt}.
     */
    public boolean sameContentAs(ShipmentSnapshot other) {
        return other != null
                && provisional == other.provisional
                && Objects.equals(shipment, other.shipment)
                && Objects.equals(offers, other.offers)
                && Objects.equals(claimTokenBalances, other.claimTokenBalances);
    }
}
