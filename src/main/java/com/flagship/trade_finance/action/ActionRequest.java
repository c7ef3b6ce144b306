package com.flagship.trade_finance.action;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * A caller's request to perform one action on one shipment.
 * Amounts are ledger base units; arguments an action does not use are null.
 */
@Value
@Builder(toBuilder = true)
public class ActionRequest {
    ActionType type;
    String shipmentId;
    String caller;
    BigInteger amount;
    Long offerId;
    Integer interestRateBps;

    public static ActionRequest enableFunding(String shipmentId, String seller) {
        return ActionRequest.builder().type(ActionType.ENABLE_FUNDING).shipmentId(shipmentId).caller(seller).build();
    }

    public static ActionRequest fund(String shipmentId, String investor, BigInteger amount) {
        return ActionRequest.builder().type(ActionType.FUND).shipmentId(shipmentId).caller(investor)
                .amount(amount).build();
    }

    public static ActionRequest createOffer(String shipmentId, String investor, BigInteger amount, int interestRateBps) {
        return ActionRequest.builder().type(ActionType.CREATE_OFFER).shipmentId(shipmentId).caller(investor)
                .amount(amount).interestRateBps(interestRateBps).build();
    }

    public static ActionRequest acceptOffer(String shipmentId, String seller, long offerId) {
        return ActionRequest.builder().type(ActionType.ACCEPT_OFFER).shipmentId(shipmentId).caller(seller)
                .offerId(offerId).build();
    }

    public static ActionRequest pay(String shipmentId, String buyer, BigInteger amount) {
        return ActionRequest.builder().type(ActionType.PAY).shipmentId(shipmentId).caller(buyer)
                .amount(amount).build();
    }

    public static ActionRequest markReceived(String shipmentId, String buyer) {
        return ActionRequest.builder().type(ActionType.MARK_RECEIVED).shipmentId(shipmentId).caller(buyer).build();
    }

    public static ActionRequest redeem(String shipmentId, String holder) {
        return ActionRequest.builder().type(ActionType.REDEEM).shipmentId(shipmentId).caller(holder).build();
    }
}
