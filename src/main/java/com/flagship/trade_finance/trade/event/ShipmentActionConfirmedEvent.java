package com.flagship.trade_finance.trade.event;

import com.flagship.trade_finance.action.ActionResult;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an orchestrated action is confirmed by the ledger.
 * Consumers refresh their cached view of the shipment.
 */
@Value
public class ShipmentActionConfirmedEvent implements ShipmentEvent {
    UUID eventId;
    String shipmentId;
    String actionType;
    String account;
    String submissionRef;
    Long offerId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ShipmentActionConfirmed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ShipmentActionConfirmedEvent from(ActionResult result, String account) {
        return new ShipmentActionConfirmedEvent(
                UUID.randomUUID(),
                result.getShipmentId(),
                result.getType().name(),
                account,
                result.getSubmissionRef(),
                result.getOfferId(),
                Instant.now()
        );
    }
}
