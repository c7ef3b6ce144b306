package com.flagship.trade_finance.query;

import java.util.List;
import java.util.Optional;

/**
 * Query and persistence service that indexes shipments and offers.
 * The orchestrator reads from it and registers through it; it owns no storage
 * of its own for these records.
 */
public interface ShipmentQueryClient {

    List<ShipmentRecord> listShipments(ShipmentFilter filter);

    Optional<ShipmentRecord> getShipment(String shipmentId);

    List<OfferRecord> listOffers(String shipmentId);

    RegistrationReceipt registerShipment(RegisterShipmentCommand command);

    DocumentUpload uploadDocument(String shipmentId, String filename, byte[] content, String contentType);
}
