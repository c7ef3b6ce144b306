package com.flagship.trade_finance.coordinator;

import com.flagship.trade_finance.action.ActionRequest;
import com.flagship.trade_finance.action.ActionResult;
import com.flagship.trade_finance.action.ActionType;
import com.flagship.trade_finance.error.ActionRejectedException;
import com.flagship.trade_finance.error.ClassifiedError;
import com.flagship.trade_finance.error.ErrorClassifier;
import com.flagship.trade_finance.error.ErrorKind;
import com.flagship.trade_finance.ledger.LedgerClient;
import com.flagship.trade_finance.ledger.LedgerOperation;
import com.flagship.trade_finance.ledger.LedgerReceipt;
import com.flagship.trade_finance.ledger.LedgerRejectedException;
import com.flagship.trade_finance.ledger.LedgerUnavailableException;
import com.flagship.trade_finance.ledger.SubmissionRef;
import com.flagship.trade_finance.lifecycle.LifecycleIntegrityException;
import com.flagship.trade_finance.lifecycle.LifecycleStateMachine;
import com.flagship.trade_finance.observability.ActionMetrics;
import com.flagship.trade_finance.observability.CorrelationContext;
import com.flagship.trade_finance.offer.FundingOffer;
import com.flagship.trade_finance.offer.OfferBook;
import com.flagship.trade_finance.reconcile.BalanceReconciler;
import com.flagship.trade_finance.reconcile.ShipmentSnapshot;
import com.flagship.trade_finance.reconcile.ShipmentStateStore;
import com.flagship.trade_finance.validation.AccountSnapshot;
import com.flagship.trade_finance.validation.PreconditionValidator;
import com.flagship.trade_finance.validation.ValidationContext;
import com.flagship.trade_finance.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes actions against the ledger.
 *
 * Protocol for one attempt:
 * 1. Load the cached shipment and read the caller's balances and allowance
 * 2. Validate; a failed precondition returns without touching the ledger
 * 3. If the allowance is short, submit an approve and wait for it to confirm
 * 4. Submit the action and wait for confirmation
 * 5. On confirmation, apply the effect to the cache and refresh the shipment
 *
 * A failure classified as NONCE_CONFLICT is retried from step 1 once, after a
 * fixed backoff. Every other failure is returned as is. A confirmation that
 * does not arrive within the timeout gives an INDETERMINATE result.
 *
 * Sequences are serialized per (account, shipment) by a {@link KeyedSequencer};
 * individual submissions are serialized per account by an
 * {@link AccountSubmissionGate}.
 */
@Slf4j
public class TransactionCoordinator {

    private final LedgerClient ledger;
    private final PreconditionValidator validator;
    private final ErrorClassifier classifier;
    private final BalanceReconciler reconciler;
    private final ShipmentStateStore store;
    private final LifecycleStateMachine lifecycle;
    private final ActionMetrics metrics;
    private final CoordinatorSettings settings;
    private final KeyedSequencer sequencer;
    private final AccountSubmissionGate submissionGate;
    private final Executor confirmationExecutor;

    public TransactionCoordinator(LedgerClient ledger,
                                  PreconditionValidator validator,
                                  ErrorClassifier classifier,
                                  BalanceReconciler reconciler,
                                  ShipmentStateStore store,
                                  LifecycleStateMachine lifecycle,
                                  ActionMetrics metrics,
                                  CoordinatorSettings settings,
                                  KeyedSequencer sequencer,
                                  AccountSubmissionGate submissionGate,
                                  Executor confirmationExecutor) {
        this.ledger = ledger;
        this.validator = validator;
        this.classifier = classifier;
        this.reconciler = reconciler;
        this.store = store;
        this.lifecycle = lifecycle;
        this.metrics = metrics;
        this.settings = settings;
        this.sequencer = sequencer;
        this.submissionGate = submissionGate;
        this.confirmationExecutor = confirmationExecutor;
    }

    /**
     * Queues the action behind any in-flight sequence of the same account on
     * the same shipment.
     */
    public CompletableFuture<ActionResult> submit(ActionRequest request) {
        if (request == null || request.getType() == null || request.getShipmentId() == null) {
            throw new IllegalArgumentException("Action type and shipment are required");
        }
        return sequencer.enqueue(sequenceKey(request), CorrelationContext.propagate(() -> run(request)));
    }

    /**
     * Blocking form of {@link #submit(ActionRequest)}.
     */
    public ActionResult execute(ActionRequest request) {
        try {
            return submit(request).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private ActionResult run(ActionRequest request) {
        long startTime = System.currentTimeMillis();
        String action = request.getType().name();
        CorrelationContext.putActionContext(request.getShipmentId(), request.getCaller());
        try {
            ActionResult result = attempt(request, 1);
            if (result.getErrorKind() != null && result.getErrorKind().isRetryable()) {
                metrics.recordRetry(action);
                log.warn("{} hit an ordering conflict, retrying once after {} ms",
                        action, settings.getNonceBackoff().toMillis());
                if (backoff()) {
                    result = attempt(request, 2);
                }
            }

            metrics.recordActionOutcome(action, result.getOutcome().name());
            if (result.getErrorKind() != null) {
                metrics.recordRejected(action, result.getErrorKind().name());
            }
            logOutcome(result);
            return result;
        } finally {
            metrics.recordActionLatency(action, System.currentTimeMillis() - startTime);
            CorrelationContext.clearActionContext();
        }
    }

    private ActionResult attempt(ActionRequest request, int attemptNumber) {
        Optional<ShipmentSnapshot> cached = reconciler.getOrRefresh(request.getShipmentId());
        if (cached.isEmpty()) {
            return ActionResult.rejected(request, ErrorKind.NOT_FOUND,
                    "Shipment " + request.getShipmentId() + " does not exist", attemptNumber);
        }
        ShipmentSnapshot snapshot = cached.get();
        String spender = snapshot.getShipment().getContractAddress();
        if (spender == null) {
            return ActionResult.rejected(request, ErrorKind.NOT_FOUND,
                    "Shipment " + request.getShipmentId() + " has no contract yet", attemptNumber);
        }

        // Only the domain action's own reference may make an outcome indeterminate
        SubmissionRef actionRef = null;
        try {
            ValidationContext context = readContext(request, snapshot, spender);
            ValidationResult validation = validator.validate(request, context);
            if (!validation.isOk()) {
                return ActionResult.rejected(request, validation.getKind(), validation.getDetail(), attemptNumber);
            }

            if (validation.isApprovalRequired()) {
                Optional<ActionResult> approvalFailure = approve(request, spender, validation.getApprovalAmount(), attemptNumber);
                if (approvalFailure.isPresent()) {
                    return approvalFailure.get();
                }
            }

            LedgerOperation operation = toOperation(request, snapshot, spender);
            actionRef = submitGated(operation);
            log.info("{} submitted: {}", request.getType(), actionRef);
            LedgerReceipt receipt = awaitBounded(actionRef);

            Long offerId = applyConfirmed(request, operation, receipt);
            refreshAfterConfirm(request.getShipmentId());
            return ActionResult.confirmed(request, receipt.getRef().getValue(), receipt.getConfirmations(),
                    attemptNumber, offerId);

        } catch (TimeoutException e) {
            return ActionResult.indeterminate(request, actionRef.getValue(), attemptNumber);
        } catch (LedgerRejectedException e) {
            ClassifiedError error = classifier.classify(e.getFailure());
            return ActionResult.failed(request, error, attemptNumber);
        } catch (LedgerUnavailableException e) {
            if (actionRef != null) {
                // Lost contact after submitting; the operation may still land
                log.warn("Ledger unavailable while waiting for {}: {}", actionRef, e.getMessage());
                return ActionResult.indeterminate(request, actionRef.getValue(), attemptNumber);
            }
            return ActionResult.failed(request, ClassifiedError.of(ErrorKind.UNKNOWN, e.getMessage()), attemptNumber);
        }
    }

    /**
     * Submits and confirms the allowance the action needs.
     *
     * @return a FAILED result when the approval did not confirm in time; the
     *         action itself is then never submitted
     */
    private Optional<ActionResult> approve(ActionRequest request, String spender, BigInteger amount, int attemptNumber) {
        LedgerOperation approve = LedgerOperation.approve(request.getCaller(), spender, amount, request.getShipmentId());
        SubmissionRef approveRef = submitGated(approve);
        log.info("Approval of {} submitted: {}", amount, approveRef);
        try {
            awaitBounded(approveRef);
            return Optional.empty();
        } catch (TimeoutException e) {
            ClassifiedError error = new ClassifiedError(ErrorKind.UNKNOWN,
                    "Approval was not confirmed in time; " + request.getType() + " was not submitted",
                    "approval " + approveRef.getValue());
            return Optional.of(ActionResult.failed(request, error, attemptNumber));
        }
    }

    private ValidationContext readContext(ActionRequest request, ShipmentSnapshot snapshot, String spender) {
        String caller = request.getCaller();
        AccountSnapshot.AccountSnapshotBuilder callerSnapshot = AccountSnapshot.builder().account(caller);
        AccountSnapshot investorSnapshot = null;

        if (caller != null && !caller.isBlank()) {
            ActionType type = request.getType();
            if (type.requiresAllowance()) {
                callerSnapshot.tokenBalance(ledger.readBalance(caller))
                        .allowance(ledger.readAllowance(caller, spender));
            }
            if (type == ActionType.FUND) {
                callerSnapshot.nativeBalance(ledger.readNativeBalance(caller));
            }
            if (type == ActionType.ACCEPT_OFFER && request.getOfferId() != null) {
                investorSnapshot = snapshot.getOffers().stream()
                        .filter(offer -> offer.getOfferId() == request.getOfferId())
                        .findFirst()
                        .map(FundingOffer::getInvestor)
                        .map(investor -> AccountSnapshot.builder()
                                .account(investor)
                                .tokenBalance(ledger.readBalance(investor))
                                .allowance(ledger.readAllowance(investor, spender))
                                .build())
                        .orElse(null);
            }
        }

        return ValidationContext.builder()
                .snapshot(snapshot)
                .caller(callerSnapshot.build())
                .offerInvestor(investorSnapshot)
                .build();
    }

    private LedgerOperation toOperation(ActionRequest request, ShipmentSnapshot snapshot, String contractAddress) {
        BigInteger amount = request.getAmount();
        if (request.getType() == ActionType.REDEEM) {
            // Redemption burns the holder's whole claim-token balance
            amount = snapshot.claimTokenBalance(request.getCaller());
        }
        return LedgerOperation.builder()
                .type(request.getType().getOperationType())
                .account(request.getCaller())
                .shipmentId(request.getShipmentId())
                .contractAddress(contractAddress)
                .amount(amount)
                .offerId(request.getOfferId())
                .interestRateBps(request.getInterestRateBps())
                .build();
    }

    private SubmissionRef submitGated(LedgerOperation operation) {
        return submissionGate.withAccount(operation.getAccount(), () -> ledger.submit(operation));
    }

    private LedgerReceipt awaitBounded(SubmissionRef ref) throws TimeoutException {
        CompletableFuture<LedgerReceipt> confirmation = CompletableFuture.supplyAsync(
                () -> ledger.awaitConfirmation(ref, settings.getConfirmations()), confirmationExecutor);
        try {
            return confirmation.get(settings.getConfirmationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            confirmation.cancel(true);
            log.warn("No confirmation for {} within {} ms", ref, settings.getConfirmationTimeout().toMillis());
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TimeoutException("Interrupted while waiting for " + ref);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new LedgerUnavailableException("Confirmation wait failed for " + ref, e.getCause());
        }
    }

    /**
     * Mirrors a confirmed action into the cache before the authoritative refresh.
     *
     * @return offer id involved, if any
     */
    private Long applyConfirmed(ActionRequest request, LedgerOperation operation, LedgerReceipt receipt) {
        Long[] offerId = {request.getOfferId()};
        try {
            store.update(request.getShipmentId(), snapshot -> {
                OfferBook book = snapshot.toOfferBook(lifecycle);
                switch (request.getType()) {
                    case CREATE_OFFER -> {
                        int bps = request.getInterestRateBps() != null ? request.getInterestRateBps() : 0;
                        if (receipt.getEmittedOfferId() != null) {
                            book.recordOffer(receipt.getEmittedOfferId(), request.getCaller(), request.getAmount(), bps);
                            offerId[0] = receipt.getEmittedOfferId();
                        } else {
                            offerId[0] = book.addOffer(request.getCaller(), request.getAmount(), bps);
                        }
                    }
                    case ACCEPT_OFFER -> book.accept(request.getOfferId(), request.getCaller());
                    case FUND -> book.creditDirectFunding(request.getCaller(), request.getAmount());
                    case REDEEM -> book.debit(request.getCaller(), operation.getAmount());
                    default -> {
                        return snapshot;
                    }
                }
                return snapshot.withOfferBook(book);
            });
        } catch (ActionRejectedException | IllegalStateException e) {
            // Cache was behind the ledger; the refresh below corrects it
            log.warn("Could not mirror confirmed {} into cache: {}", request.getType(), e.getMessage());
        }
        return offerId[0];
    }

    private void refreshAfterConfirm(String shipmentId) {
        try {
            reconciler.refresh(shipmentId);
        } catch (LifecycleIntegrityException e) {
            log.error("Confirmed action left shipment {} in an inconsistent state: {}", shipmentId, e.getMessage());
        }
    }

    private boolean backoff() {
        try {
            Thread.sleep(settings.getNonceBackoff().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void logOutcome(ActionResult result) {
        switch (result.getOutcome()) {
            case CONFIRMED -> log.info("{} confirmed: ref={}, confirmations={}, attempts={}",
                    result.getType(), result.getSubmissionRef(), result.getConfirmations(), result.getAttempts());
            case FAILED -> log.warn("{} failed: kind={}, message={}, diagnostic={}",
                    result.getType(), result.getErrorKind(), result.getMessage(), result.getDiagnostic());
            case INDETERMINATE -> log.warn("{} indeterminate: ref={}", result.getType(), result.getSubmissionRef());
        }
    }

    static String sequenceKey(ActionRequest request) {
        String caller = request.getCaller() != null ? request.getCaller().toLowerCase(Locale.ROOT) : "";
        return caller + "|" + request.getShipmentId().toLowerCase(Locale.ROOT);
    }
}
