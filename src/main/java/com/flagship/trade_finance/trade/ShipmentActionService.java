package com.flagship.trade_finance.trade;

import com.flagship.trade_finance.action.ActionRequest;
import com.flagship.trade_finance.action.ActionResult;
import com.flagship.trade_finance.coordinator.TransactionCoordinator;
import com.flagship.trade_finance.error.ClassifiedError;
import com.flagship.trade_finance.error.ErrorKind;
import com.flagship.trade_finance.observability.ActionMetrics;
import com.flagship.trade_finance.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Idempotent entry point for orchestrated actions.
 *
 * 1. A key seen before returns the stored result without touching the ledger
 * 2. Otherwise a PENDING record claims the key (own transaction)
 * 3. The coordinator runs outside any database transaction
 * 4. The outcome is stored, with a ShipmentActionConfirmed outbox event when confirmed
 *
 * A key reused for a different action is refused. A key whose first request is
 * still running is reported as a conflict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShipmentActionService {

    private final TransactionCoordinator coordinator;
    private final ActionRecordService recordService;
    private final IdempotencyService idempotencyService;
    private final ActionMetrics metrics;

    public ActionResult execute(String idempotencyKey, ActionRequest request) {
        CorrelationContext.putActionContext(request.getShipmentId(), request.getCaller());
        try {
            Optional<ActionRecord> existing = idempotencyService.checkIdempotencyKey(idempotencyKey)
                    .flatMap(recordService::findById);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning stored outcome");
                return replay(existing.get(), request);
            }
            metrics.recordIdempotencyMiss();

            ActionRecord reserved;
            try {
                reserved = recordService.reserve(idempotencyKey, request);
            } catch (DataIntegrityViolationException e) {
                // Lost the race to a concurrent request carrying the same key
                ActionRecord winner = recordService.findByIdempotencyKey(idempotencyKey).orElseThrow(() -> e);
                return replay(winner, request);
            }
            idempotencyService.storeIdempotencyKey(idempotencyKey, reserved.getId());

            log.info("Executing {} for shipment {}", request.getType(), request.getShipmentId());
            ActionResult result = runCoordinator(reserved.getId(), request);
            recordService.complete(reserved.getId(), result);
            return result;
        } finally {
            CorrelationContext.clearActionContext();
        }
    }

    private ActionResult runCoordinator(UUID recordId, ActionRequest request) {
        try {
            return coordinator.execute(request);
        } catch (RuntimeException e) {
            // Keep the key from staying PENDING forever
            recordService.complete(recordId, ActionResult.failed(request,
                    ClassifiedError.of(ErrorKind.UNKNOWN, e.getMessage()), 1));
            throw e;
        }
    }

    private ActionResult replay(ActionRecord record, ActionRequest request) {
        if (!record.describes(request)) {
            throw new IllegalArgumentException(
                    "Idempotency key was already used for a different request (" + record.getActionType()
                            + " on " + record.getShipmentId() + ")");
        }
        if (record.getStatus() == ActionRecordStatus.PENDING) {
            throw new IllegalStateException("An action with this idempotency key is still in progress");
        }
        return record.toResult();
    }
}
