package com.flagship.trade_finance.action;

import com.flagship.trade_finance.ledger.OperationType;

/**
 * Orchestrated shipment actions.
 *
 * Actions that pull tokens from the caller need an allowance granted to the
 * shipment contract first; for those the coordinator schedules an approve step
 * when the current allowance is too low.
 */
public enum ActionType {
    ENABLE_FUNDING(ActorRole.SELLER, false, OperationType.ENABLE_FUNDING),
    FUND(ActorRole.INVESTOR, true, OperationType.FUND),
    CREATE_OFFER(ActorRole.INVESTOR, true, OperationType.CREATE_OFFER),
    ACCEPT_OFFER(ActorRole.SELLER, false, OperationType.ACCEPT_OFFER),
    PAY(ActorRole.BUYER, true, OperationType.PAY),
    MARK_RECEIVED(ActorRole.BUYER, false, OperationType.MARK_RECEIVED),
    REDEEM(ActorRole.CLAIM_HOLDER, false, OperationType.REDEEM);

    private final ActorRole role;
    private final boolean requiresAllowance;
    private final OperationType operationType;

    ActionType(ActorRole role, boolean requiresAllowance, OperationType operationType) {
        this.role = role;
        this.requiresAllowance = requiresAllowance;
        this.operationType = operationType;
    }

    public ActorRole getRole() {
        return role;
    }

    public boolean requiresAllowance() {
        return requiresAllowance;
    }

    public OperationType getOperationType() {
        return operationType;
    }
}
