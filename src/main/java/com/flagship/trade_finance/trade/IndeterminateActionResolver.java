package com.flagship.trade_finance.trade;

import com.flagship.trade_finance.action.ActionResult;
import com.flagship.trade_finance.coordinator.CoordinatorSettings;
import com.flagship.trade_finance.error.ClassifiedError;
import com.flagship.trade_finance.error.ErrorClassifier;
import com.flagship.trade_finance.error.ErrorKind;
import com.flagship.trade_finance.ledger.LedgerClient;
import com.flagship.trade_finance.ledger.LedgerReceipt;
import com.flagship.trade_finance.ledger.LedgerRejectedException;
import com.flagship.trade_finance.ledger.LedgerUnavailableException;
import com.flagship.trade_finance.ledger.SubmissionRef;
import com.flagship.trade_finance.lifecycle.LifecycleIntegrityException;
import com.flagship.trade_finance.reconcile.BalanceReconciler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Looks up submissions of INDETERMINATE action records again and settles them
 * as CONFIRMED or FAILED once the ledger has an answer.
 *
 * Records stay INDETERMINATE while the ledger is unreachable or still has not
 * confirmed the operation.
 */
@Component
@ConditionalOnProperty(name = "coordinator.resolver.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class IndeterminateActionResolver {

    private final ActionRecordService recordService;
    private final LedgerClient ledger;
    private final ErrorClassifier classifier;
    private final BalanceReconciler reconciler;
    private final CoordinatorSettings settings;
    private final Executor confirmationExecutor;
    private final int batchSize;

    public IndeterminateActionResolver(ActionRecordService recordService,
                                       LedgerClient ledger,
                                       ErrorClassifier classifier,
                                       BalanceReconciler reconciler,
                                       CoordinatorSettings settings,
                                       @Qualifier("confirmationExecutor") Executor confirmationExecutor,
                                       @Value("${coordinator.resolver.batch-size:20}") int batchSize) {
        this.recordService = recordService;
        this.ledger = ledger;
        this.classifier = classifier;
        this.reconciler = reconciler;
        this.settings = settings;
        this.confirmationExecutor = confirmationExecutor;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${coordinator.resolver.interval-ms:30000}")
    public void resolvePending() {
        try {
            List<ActionRecord> records = recordService.findIndeterminate(batchSize);
            int resolved = 0;
            for (ActionRecord record : records) {
                if (resolve(record)) {
                    resolved++;
                }
            }
            if (resolved > 0) {
                log.info("Resolved {} of {} indeterminate actions", resolved, records.size());
            }
        } catch (Exception e) {
            log.error("Error while resolving indeterminate actions", e);
        }
    }

    /**
     * @return true if the record left the INDETERMINATE state
     */
    boolean resolve(ActionRecord record) {
        if (record.getSubmissionRef() == null) {
            recordService.complete(record.getId(), ActionResult.failed(record.toRequest(),
                    ClassifiedError.of(ErrorKind.UNKNOWN, "No submission reference recorded"), record.getAttempts()));
            return true;
        }

        SubmissionRef ref = SubmissionRef.of(record.getSubmissionRef());
        CompletableFuture<LedgerReceipt> confirmation = CompletableFuture.supplyAsync(
                () -> ledger.awaitConfirmation(ref, settings.getConfirmations()), confirmationExecutor);
        try {
            LedgerReceipt receipt = confirmation.get(settings.getConfirmationTimeout().toMillis(), TimeUnit.MILLISECONDS);
            Long offerId = receipt.getEmittedOfferId() != null ? receipt.getEmittedOfferId() : record.getOfferId();
            recordService.complete(record.getId(), ActionResult.confirmed(record.toRequest(),
                    ref.getValue(), receipt.getConfirmations(), record.getAttempts(), offerId));
            log.info("{} on shipment {} confirmed late: ref={}", record.getActionType(), record.getShipmentId(), ref);
            refresh(record.getShipmentId());
            return true;

        } catch (TimeoutException e) {
            confirmation.cancel(true);
            log.debug("{} still unconfirmed", ref);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof LedgerRejectedException rejected) {
                ClassifiedError error = classifier.classify(rejected.getFailure());
                recordService.complete(record.getId(),
                        ActionResult.failed(record.toRequest(), error, record.getAttempts()));
                log.warn("{} on shipment {} reverted: kind={}, diagnostic={}",
                        record.getActionType(), record.getShipmentId(), error.getKind(), error.getDiagnostic());
                refresh(record.getShipmentId());
                return true;
            }
            if (e.getCause() instanceof LedgerUnavailableException) {
                log.debug("Ledger unavailable while resolving {}: {}", ref, e.getCause().getMessage());
                return false;
            }
            throw new IllegalStateException("Unexpected failure resolving " + ref, e.getCause());
        }
    }

    private void refresh(String shipmentId) {
        try {
            reconciler.refresh(shipmentId);
        } catch (LifecycleIntegrityException e) {
            log.error("Shipment {} is in an inconsistent state: {}", shipmentId, e.getMessage());
        }
    }
}
