package com.flagship.trade_finance.lifecycle;

/**
 * Linear shipment lifecycle. Declaration order is the transition order.
 */
public enum LifecycleStage {
    MINTED,
    FUNDING_ENABLED,
    ARRIVED,
    PAID,
    SETTLED;

    public boolean isTerminal() {
        return this == SETTLED;
    }

    public boolean isAtLeast(LifecycleStage other) {
        return this.ordinal() >= other.ordinal();
    }
}
