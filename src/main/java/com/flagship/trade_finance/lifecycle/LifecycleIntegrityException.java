package com.flagship.trade_finance.lifecycle;

/**
 * Stage timestamps of a shipment are inconsistent. Not recoverable locally.
 */
public class LifecycleIntegrityException extends IllegalStateException {

    private final String shipmentId;

    public LifecycleIntegrityException(String shipmentId, String message) {
        super(String.format("Shipment %s: %s", shipmentId, message));
        this.shipmentId = shipmentId;
    }

    public String getShipmentId() {
        return shipmentId;
    }
}
