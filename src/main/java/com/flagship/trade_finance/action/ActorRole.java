package com.flagship.trade_finance.action;

/**
 * Role the caller must hold for an action.
 */
public enum ActorRole {
    SELLER,
    BUYER,
    INVESTOR,
    CLAIM_HOLDER
}
