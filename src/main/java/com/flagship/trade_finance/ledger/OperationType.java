package com.flagship.trade_finance.ledger;

/**
 * Ledger operations the orchestrator submits. Each maps to one signed call.
 */
public enum OperationType {
    APPROVE,
    ENABLE_FUNDING,
    FUND,
    CREATE_OFFER,
    ACCEPT_OFFER,
    PAY,
    MARK_RECEIVED,
    REDEEM
}
