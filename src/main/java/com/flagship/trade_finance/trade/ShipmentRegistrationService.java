package com.flagship.trade_finance.trade;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.trade_finance.outbox.OutboxService;
import com.flagship.trade_finance.query.DocumentUpload;
import com.flagship.trade_finance.query.QueryServiceException;
import com.flagship.trade_finance.query.RegisterShipmentCommand;
import com.flagship.trade_finance.query.RegistrationReceipt;
import com.flagship.trade_finance.query.ShipmentQueryClient;
import com.flagship.trade_finance.reconcile.BalanceReconciler;
import com.flagship.trade_finance.shipment.Shipment;
import com.flagship.trade_finance.shipment.ShipmentHasher;
import com.flagship.trade_finance.shipment.TokenAmounts;
import com.flagship.trade_finance.trade.event.ShipmentRegisteredEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Registers new shipments and stores their documents.
 *
 * The query service mints the shipment on the ledger. Until its index catches
 * up, a provisional entry keyed by the BoL hash keeps the shipment visible in
 * listings; the first authoritative refresh replaces it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShipmentRegistrationService {

    private static final int HTTP_BAD_GATEWAY = 502;

    private final ShipmentHasher hasher;
    private final ShipmentQueryClient queryClient;
    private final BalanceReconciler reconciler;
    private final OutboxService outboxService;
    private final TokenAmounts tokenAmounts;
    private final TransactionTemplate transactionTemplate;

    /**
     * @return the query service's receipt, with the locally computed hash
     * @throws IllegalArgumentException if the document or parties are missing or the value is not positive
     * @throws QueryServiceException if the query service refuses the registration
     */
    public RegistrationReceipt register(ShipmentRegistration registration) {
        validate(registration);
        String bolHash = hasher.hash(registration.getDocument());

        log.info("Registering shipment {} for carrier {}", bolHash, registration.getCarrier());
        RegistrationReceipt receipt = queryClient.registerShipment(RegisterShipmentCommand.builder()
                .bolHash(bolHash)
                .document(registration.getDocument())
                .declaredValue(registration.getDeclaredValue())
                .carrier(registration.getCarrier())
                .seller(registration.getSeller())
                .buyer(registration.getBuyer())
                .pdfUrl(registration.getPdfUrl())
                .build());

        if (!receipt.isSuccess()) {
            throw new QueryServiceException(
                    receipt.getMessage() != null ? receipt.getMessage() : "Shipment registration was refused",
                    HTTP_BAD_GATEWAY, null);
        }

        Shipment provisional = Shipment.builder()
                .bolHash(bolHash)
                .contractAddress(receipt.getContractAddress())
                .seller(registration.getSeller())
                .buyer(registration.getBuyer())
                .carrier(registration.getCarrier())
                .blNumber(textField(registration.getDocument(), "blNumber"))
                .documentUrl(registration.getPdfUrl())
                .declaredValue(tokenAmounts.toBaseUnits(registration.getDeclaredValue()))
                .mintedAt(Instant.now())
                .build();
        reconciler.mergeOptimistic(provisional);

        transactionTemplate.executeWithoutResult(status -> outboxService.saveEvent(
                ShipmentRegisteredEvent.of(bolHash, receipt.getContractAddress(),
                        registration.getCarrier(), registration.getDeclaredValue())));

        return RegistrationReceipt.builder()
                .success(true)
                .bolHash(bolHash)
                .contractAddress(receipt.getContractAddress())
                .transactionHash(receipt.getTransactionHash())
                .message(receipt.getMessage())
                .build();
    }

    /**
     * Stores a shipment document. When {@code shipmentId} already has one, the
     * stored document is returned with {@code alreadyExists} set.
     */
    public DocumentUpload attachDocument(String shipmentId, String filename, byte[] content, String contentType) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("No file provided");
        }
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("File is empty");
        }
        DocumentUpload upload = queryClient.uploadDocument(shipmentId, filename, content, contentType);
        if (upload.isAlreadyExists()) {
            log.info("Shipment {} already has a document at {}", shipmentId, upload.getPdfUrl());
        }
        return upload;
    }

    private void validate(ShipmentRegistration registration) {
        JsonNode document = registration.getDocument();
        if (document == null || !document.isObject() || document.isEmpty()) {
            throw new IllegalArgumentException("Shipment document is required");
        }
        BigDecimal value = registration.getDeclaredValue();
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException("Declared value must be positive");
        }
        requireParty(registration.getCarrier(), "carrier");
        requireParty(registration.getSeller(), "seller");
        requireParty(registration.getBuyer(), "buyer");
    }

    private static void requireParty(String account, String role) {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("The " + role + " account is required");
        }
    }

    private static String textField(JsonNode document, String field) {
        JsonNode node = document.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
