package com.flagship.trade_finance.trade;

import com.flagship.trade_finance.action.ActionRequest;
import com.flagship.trade_finance.action.ActionResult;
import com.flagship.trade_finance.lifecycle.LifecycleStage;
import com.flagship.trade_finance.lifecycle.LifecycleStateMachine;
import com.flagship.trade_finance.reconcile.BalanceReconciler;
import com.flagship.trade_finance.reconcile.ShipmentSnapshot;
import com.flagship.trade_finance.reconcile.ShipmentStateStore;
import com.flagship.trade_finance.shipment.TokenAmounts;
import com.flagship.trade_finance.trade.dto.ActionResultResponse;
import com.flagship.trade_finance.trade.dto.AmountRequest;
import com.flagship.trade_finance.trade.dto.DocumentUploadResponse;
import com.flagship.trade_finance.trade.dto.OfferRequest;
import com.flagship.trade_finance.trade.dto.OfferResponse;
import com.flagship.trade_finance.trade.dto.RegisterShipmentRequest;
import com.flagship.trade_finance.trade.dto.RegistrationResponse;
import com.flagship.trade_finance.trade.dto.ShipmentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * REST surface for shipments.
 *
 * Reads are served from the state store. Action endpoints require the acting
 * account in X-Account and an Idempotency-Key; their outcome maps to
 * 200 (CONFIRMED), 422 (FAILED) or 202 (INDETERMINATE).
 */
@RestController
@RequestMapping("/api/shipments")
@RequiredArgsConstructor
@Slf4j
public class ShipmentController {

    static final String ACCOUNT_HEADER = "X-Account";
    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final ShipmentActionService actionService;
    private final ShipmentRegistrationService registrationService;
    private final ShipmentStateStore store;
    private final BalanceReconciler reconciler;
    private final LifecycleStateMachine lifecycle;
    private final TokenAmounts tokenAmounts;

    @GetMapping
    public List<ShipmentResponse> listShipments(@RequestParam(name = "stage", required = false) LifecycleStage stage) {
        return store.list().stream()
                .map(snapshot -> ShipmentResponse.from(snapshot, lifecycle.stageOf(snapshot.getShipment()), tokenAmounts))
                .filter(response -> stage == null || response.getStage() == stage)
                .toList();
    }

    @GetMapping("/{hash}")
    public ResponseEntity<ShipmentResponse> getShipment(@PathVariable("hash") String hash) {
        return find(hash)
                .map(snapshot -> ResponseEntity.ok(
                        ShipmentResponse.from(snapshot, lifecycle.stageOf(snapshot.getShipment()), tokenAmounts)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{hash}/offers")
    public ResponseEntity<List<OfferResponse>> listOffers(@PathVariable("hash") String hash) {
        return find(hash)
                .map(snapshot -> ResponseEntity.ok(snapshot.getOffers().stream()
                        .map(offer -> OfferResponse.from(offer, tokenAmounts))
                        .toList()))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<RegistrationResponse> registerShipment(@Valid @RequestBody RegisterShipmentRequest request) {
        var receipt = registrationService.register(ShipmentRegistration.builder()
                .document(request.getDocument())
                .declaredValue(request.getDeclaredValue())
                .carrier(request.getCarrier())
                .seller(request.getSeller())
                .buyer(request.getBuyer())
                .pdfUrl(request.getPdfUrl())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(RegistrationResponse.from(receipt));
    }

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public DocumentUploadResponse uploadDocument(@RequestPart("file") MultipartFile file,
                                                 @RequestParam(name = "bol_hash", required = false) String bolHash)
            throws IOException {
        return DocumentUploadResponse.from(registrationService.attachDocument(
                bolHash, file.getOriginalFilename(), file.getBytes(), file.getContentType()));
    }

    @PostMapping("/{hash}/funding")
    public ResponseEntity<ActionResultResponse> enableFunding(
            @PathVariable("hash") String hash,
            @RequestHeader(ACCOUNT_HEADER) String account,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {
        return execute(idempotencyKey, ActionRequest.enableFunding(hash, account));
    }

    @PostMapping("/{hash}/fund")
    public ResponseEntity<ActionResultResponse> fund(
            @PathVariable("hash") String hash,
            @RequestHeader(ACCOUNT_HEADER) String account,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody AmountRequest request) {
        return execute(idempotencyKey,
                ActionRequest.fund(hash, account, tokenAmounts.toBaseUnits(request.getAmount())));
    }

    @PostMapping("/{hash}/offers")
    public ResponseEntity<ActionResultResponse> createOffer(
            @PathVariable("hash") String hash,
            @RequestHeader(ACCOUNT_HEADER) String account,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody OfferRequest request) {
        return execute(idempotencyKey, ActionRequest.createOffer(hash, account,
                tokenAmounts.toBaseUnits(request.getAmount()), request.getInterestRateBps()));
    }

    @PostMapping("/{hash}/offers/{offerId}/accept")
    public ResponseEntity<ActionResultResponse> acceptOffer(
            @PathVariable("hash") String hash,
            @PathVariable("offerId") long offerId,
            @RequestHeader(ACCOUNT_HEADER) String account,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {
        return execute(idempotencyKey, ActionRequest.acceptOffer(hash, account, offerId));
    }

    @PostMapping("/{hash}/pay")
    public ResponseEntity<ActionResultResponse> pay(
            @PathVariable("hash") String hash,
            @RequestHeader(ACCOUNT_HEADER) String account,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody AmountRequest request) {
        return execute(idempotencyKey,
                ActionRequest.pay(hash, account, tokenAmounts.toBaseUnits(request.getAmount())));
    }

    @PostMapping("/{hash}/receipt")
    public ResponseEntity<ActionResultResponse> markReceived(
            @PathVariable("hash") String hash,
            @RequestHeader(ACCOUNT_HEADER) String account,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {
        return execute(idempotencyKey, ActionRequest.markReceived(hash, account));
    }

    @PostMapping("/{hash}/redeem")
    public ResponseEntity<ActionResultResponse> redeem(
            @PathVariable("hash") String hash,
            @RequestHeader(ACCOUNT_HEADER) String account,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {
        return execute(idempotencyKey, ActionRequest.redeem(hash, account));
    }

    private ResponseEntity<ActionResultResponse> execute(String idempotencyKey, ActionRequest request) {
        ActionResult result = actionService.execute(idempotencyKey, request);
        HttpStatus status = switch (result.getOutcome()) {
            case CONFIRMED -> HttpStatus.OK;
            case FAILED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INDETERMINATE -> HttpStatus.ACCEPTED;
        };
        return ResponseEntity.status(status).body(ActionResultResponse.from(result));
    }

    /**
     * Cached entry, provisional ones included; unknown shipments are looked up once.
     */
    private Optional<ShipmentSnapshot> find(String hash) {
        return store.get(hash).or(() -> reconciler.refresh(hash));
    }
}
