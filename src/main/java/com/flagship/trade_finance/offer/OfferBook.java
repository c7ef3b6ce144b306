package com.flagship.trade_finance.offer;

import com.flagship.trade_finance.error.ActionRejectedException;
import com.flagship.trade_finance.error.ErrorKind;
import com.flagship.trade_finance.lifecycle.LifecycleStage;
import com.flagship.trade_finance.lifecycle.LifecycleStateMachine;
import com.flagship.trade_finance.shipment.Shipment;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Funding offers and claim-token balances of one shipment.
 *
 * An OfferBook is a mutable working copy. It is built from a cached snapshot,
 * mutated while applying a single action, and exported again; the cache itself
 * is never mutated in place.
 *
 * Invariants enforced here:
 * - totalFunded never exceeds declaredValue
 * - an accepted offer never reverts
 * - claim-token balances never go negative
 */
public class OfferBook {

    private final LifecycleStateMachine lifecycle;
    private final TreeMap<Long, FundingOffer> offers = new TreeMap<>();
    private final Map<String, BigInteger> claimTokenBalances = new HashMap<>();
    private Shipment shipment;

    public OfferBook(LifecycleStateMachine lifecycle, Shipment shipment,
                     Collection<FundingOffer> offers, Map<String, BigInteger> claimTokenBalances) {
        if (shipment == null) {
            throw new IllegalArgumentException("Shipment cannot be null");
        }
        this.lifecycle = lifecycle;
        this.shipment = shipment;
        if (offers != null) {
            offers.forEach(offer -> this.offers.put(offer.getOfferId(), offer));
        }
        if (claimTokenBalances != null) {
            claimTokenBalances.forEach((holder, balance) -> this.claimTokenBalances.put(normalize(holder), balance));
        }
    }

    /**
     * Registers a new unaccepted offer.
     *
     * @return the id assigned to the offer
     */
    public long addOffer(String investor, BigInteger amount, int interestRateBps) {
        long offerId = nextOfferId();
        recordOffer(offerId, investor, amount, interestRateBps);
        return offerId;
    }

    /**
     * Registers an offer under an id already assigned by the ledger.
     */
    public FundingOffer recordOffer(long offerId, String investor, BigInteger amount, int interestRateBps) {
        if (investor == null || investor.isBlank()) {
            throw new IllegalArgumentException("Investor is required");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ActionRejectedException(ErrorKind.INVALID_AMOUNT, "Offer amount must be positive");
        }
        if (interestRateBps < 0) {
            throw new ActionRejectedException(ErrorKind.INVALID_AMOUNT, "Interest rate cannot be negative");
        }
        requireOpenForFunding();
        if (amount.compareTo(remainingCapacity()) > 0) {
            throw new ActionRejectedException(ErrorKind.EXCEEDS_DECLARED_VALUE,
                    String.format("Offer of %s exceeds remaining capacity %s", amount, remainingCapacity()));
        }
        if (offers.containsKey(offerId)) {
            throw new IllegalStateException("Offer id already used: " + offerId);
        }

        FundingOffer offer = FundingOffer.open(shipment.getBolHash(), offerId, investor, amount, interestRateBps);
        offers.put(offerId, offer);
        return offer;
    }

    /**
     * Accepts an offer on behalf of the seller.
     *
     * Checks run in a fixed order so callers get a stable error kind:
     * caller, existence, prior acceptance, funding state, capacity.
     *
     * @return the accepted offer
     */
    public FundingOffer accept(long offerId, String caller) {
        if (!shipment.isSeller(caller)) {
            throw new ActionRejectedException(ErrorKind.UNAUTHORIZED, "Only the seller can accept offers");
        }
        FundingOffer offer = offers.get(offerId);
        if (offer == null) {
            throw new ActionRejectedException(ErrorKind.NOT_FOUND, "Offer " + offerId + " does not exist");
        }
        if (offer.isAccepted()) {
            throw new ActionRejectedException(ErrorKind.ALREADY_ACCEPTED);
        }
        requireOpenForFunding();

        BigInteger claimTokens = offer.claimTokens();
        BigInteger newTotal = shipment.getTotalFunded().add(claimTokens);
        if (newTotal.compareTo(shipment.getDeclaredValue()) > 0) {
            throw new ActionRejectedException(ErrorKind.EXCEEDS_DECLARED_VALUE,
                    String.format("Accepting offer %d would raise total funding to %s, above declared value %s",
                            offerId, newTotal, shipment.getDeclaredValue()));
        }

        FundingOffer accepted = offer.accept();
        offers.put(offerId, accepted);
        credit(accepted.getInvestor(), claimTokens);
        shipment = shipment.toBuilder().totalFunded(newTotal).build();
        return accepted;
    }

    /**
     * Direct funding outside an offer: credited at face value.
     */
    public void creditDirectFunding(String holder, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ActionRejectedException(ErrorKind.INVALID_AMOUNT, "Funding amount must be positive");
        }
        requireOpenForFunding();
        BigInteger newTotal = shipment.getTotalFunded().add(amount);
        if (newTotal.compareTo(shipment.getDeclaredValue()) > 0) {
            throw new ActionRejectedException(ErrorKind.EXCEEDS_DECLARED_VALUE);
        }
        credit(holder, amount);
        shipment = shipment.toBuilder().totalFunded(newTotal).build();
    }

    /**
     * Removes claim tokens from a holder, as on redemption.
     */
    public void debit(String holder, BigInteger amount) {
        BigInteger balance = claimTokenBalance(holder);
        if (amount == null || amount.signum() <= 0 || amount.compareTo(balance) > 0) {
            throw new ActionRejectedException(ErrorKind.INSUFFICIENT_BALANCE,
                    String.format("Cannot redeem %s with claim-token balance %s", amount, balance));
        }
        claimTokenBalances.put(normalize(holder), balance.subtract(amount));
    }

    public BigInteger remainingCapacity() {
        return shipment.remainingCapacity();
    }

    public BigInteger claimTokenBalance(String holder) {
        if (holder == null) {
            return BigInteger.ZERO;
        }
        return claimTokenBalances.getOrDefault(normalize(holder), BigInteger.ZERO);
    }

    public Optional<FundingOffer> findOffer(long offerId) {
        return Optional.ofNullable(offers.get(offerId));
    }

    public List<FundingOffer> offers() {
        return Collections.unmodifiableList(new ArrayList<>(offers.values()));
    }

    public Map<String, BigInteger> claimTokenBalances() {
        return Collections.unmodifiableMap(new HashMap<>(claimTokenBalances));
    }

    public Shipment shipment() {
        return shipment;
    }

    private long nextOfferId() {
        return offers.isEmpty() ? 0L : offers.lastKey() + 1;
    }

    private void requireOpenForFunding() {
        LifecycleStage stage = lifecycle.stageOf(shipment);
        if (stage == LifecycleStage.SETTLED) {
            throw new ActionRejectedException(ErrorKind.ALREADY_SETTLED);
        }
        if (stage == LifecycleStage.MINTED) {
            throw new ActionRejectedException(ErrorKind.FUNDING_NOT_ENABLED);
        }
    }

    private void credit(String holder, BigInteger amount) {
        claimTokenBalances.merge(normalize(holder), amount, BigInteger::add);
    }

    private static String normalize(String account) {
        return account.toLowerCase(Locale.ROOT);
    }
}
