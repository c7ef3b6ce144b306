package com.flagship.trade_finance.coordinator;

import com.flagship.trade_finance.action.ActionOutcome;
import com.flagship.trade_finance.action.ActionRequest;
import com.flagship.trade_finance.action.ActionResult;
import com.flagship.trade_finance.error.ErrorClassifier;
import com.flagship.trade_finance.error.ErrorKind;
import com.flagship.trade_finance.error.LedgerFailure;
import com.flagship.trade_finance.ledger.LedgerRejectedException;
import com.flagship.trade_finance.ledger.LedgerUnavailableException;
import com.flagship.trade_finance.ledger.OperationType;
import com.flagship.trade_finance.lifecycle.LifecycleStateMachine;
import com.flagship.trade_finance.observability.ActionMetrics;
import com.flagship.trade_finance.reconcile.BalanceReconciler;
import com.flagship.trade_finance.reconcile.ShipmentSnapshot;
import com.flagship.trade_finance.reconcile.ShipmentStateStore;
import com.flagship.trade_finance.support.FakeLedger;
import com.flagship.trade_finance.support.Shipments;
import com.flagship.trade_finance.validation.PreconditionValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.flagship.trade_finance.support.Shipments.BUYER;
import static com.flagship.trade_finance.support.Shipments.CONTRACT;
import static com.flagship.trade_finance.support.Shipments.HASH;
import static com.flagship.trade_finance.support.Shipments.INVESTOR;
import static com.flagship.trade_finance.support.Shipments.SELLER;
import static com.flagship.trade_finance.support.Shipments.tokens;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TransactionCoordinatorTest {

    private static final BigInteger RESERVE = BigInteger.TEN.pow(15);

    private final LifecycleStateMachine lifecycle = new LifecycleStateMachine();
    private FakeLedger ledger;
    private ShipmentStateStore store;
    private SimpleMeterRegistry meterRegistry;
    private ExecutorService workers;
    private ExecutorService confirmations;
    private TransactionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        ledger = new FakeLedger()
                .withBalance(INVESTOR, tokens(1000), tokens(1))
                .withBalance(BUYER, tokens(2000), tokens(1));
        store = new ShipmentStateStore();
        store.replaceIfChanged(Shipments.snapshot(Shipments.fundingEnabled(1000)));

        BalanceReconciler reconciler = mock(BalanceReconciler.class);
        when(reconciler.getOrRefresh(anyString())).thenAnswer(inv -> store.getAuthoritative(inv.getArgument(0)));
        when(reconciler.refresh(anyString())).thenAnswer(inv -> store.get(inv.getArgument(0)));

        meterRegistry = new SimpleMeterRegistry();
        workers = Executors.newFixedThreadPool(4);
        confirmations = Executors.newCachedThreadPool();
        CoordinatorSettings settings = CoordinatorSettings.builder()
                .confirmationTimeout(Duration.ofMillis(300))
                .nonceBackoff(Duration.ofMillis(10))
                .build();

        coordinator = new TransactionCoordinator(ledger, new PreconditionValidator(lifecycle, RESERVE),
                new ErrorClassifier(), reconciler, store, lifecycle, new ActionMetrics(meterRegistry), settings,
                new KeyedSequencer(workers), new AccountSubmissionGate(), confirmations);
    }

    @AfterEach
    void tearDown() {
        ledger.releaseConfirmations();
        workers.shutdownNow();
        confirmations.shutdownNow();
    }

    private ShipmentSnapshot cached() {
        return store.get(HASH).orElseThrow();
    }

    @Test
    @DisplayName("Confirmed funding is mirrored into the cache")
    void fundConfirmed() {
        ledger.withAllowance(INVESTOR, CONTRACT, tokens(1000));

        ActionResult result = coordinator.execute(ActionRequest.fund(HASH, INVESTOR, tokens(100)));

        assertEquals(ActionOutcome.CONFIRMED, result.getOutcome());
        assertNotNull(result.getSubmissionRef());
        assertEquals(1, result.getConfirmations());
        assertEquals(1, result.getAttempts());
        assertEquals(List.of(OperationType.FUND), ledger.submittedTypes());
        assertEquals(tokens(100), cached().getShipment().getTotalFunded());
        assertEquals(tokens(100), cached().claimTokenBalance(INVESTOR));
    }

    @Test
    @DisplayName("A short allowance is approved before the action is submitted")
    void approvesFirst() {
        ActionResult result = coordinator.execute(ActionRequest.fund(HASH, INVESTOR, tokens(100)));

        assertTrue(result.isConfirmed());
        assertEquals(List.of(OperationType.APPROVE, OperationType.FUND), ledger.submittedTypes());
        assertEquals(tokens(100), ledger.submittedOperations().get(0).getAmount());
        assertEquals(CONTRACT, ledger.submittedOperations().get(0).getSpender());
    }

    @Test
    @DisplayName("A failed precondition never reaches the ledger")
    void preconditionFailure() {
        ActionResult result = coordinator.execute(ActionRequest.pay(HASH, BUYER, tokens(900)));

        assertEquals(ActionOutcome.FAILED, result.getOutcome());
        assertEquals(ErrorKind.INVALID_AMOUNT, result.getErrorKind());
        assertTrue(ledger.submittedOperations().isEmpty());
        assertEquals(1.0, meterRegistry.counter("actions.rejected",
                "action", "PAY", "kind", "INVALID_AMOUNT").count());
    }

    @Test
    @DisplayName("One ordering conflict is retried and then succeeds")
    void nonceConflictRetriedOnce() {
        ledger.withAllowance(INVESTOR, CONTRACT, tokens(1000));
        ledger.failNextSubmit(new LedgerRejectedException(LedgerFailure.ofReason("nonce too low")));

        ActionResult result = coordinator.execute(ActionRequest.fund(HASH, INVESTOR, tokens(100)));

        assertTrue(result.isConfirmed());
        assertEquals(2, result.getAttempts());
        assertEquals(List.of(OperationType.FUND, OperationType.FUND), ledger.submittedTypes());
        assertEquals(1.0, meterRegistry.counter("ledger.retries", "action", "FUND").count());
    }

    @Test
    @DisplayName("A second ordering conflict is returned to the caller")
    void secondNonceConflictSurfaces() {
        ledger.withAllowance(INVESTOR, CONTRACT, tokens(1000));
        ledger.failNextSubmit(new LedgerRejectedException(LedgerFailure.ofCode("NONCE_EXPIRED")));
        ledger.failNextSubmit(new LedgerRejectedException(LedgerFailure.ofCode("NONCE_EXPIRED")));

        ActionResult result = coordinator.execute(ActionRequest.fund(HASH, INVESTOR, tokens(100)));

        assertEquals(ActionOutcome.FAILED, result.getOutcome());
        assertEquals(ErrorKind.NONCE_CONFLICT, result.getErrorKind());
        assertEquals(ErrorKind.NONCE_CONFLICT.getDefaultMessage(), result.getMessage());
        assertEquals(2, result.getAttempts());
        assertEquals(2, ledger.submittedOperations().size());
        assertEquals(BigInteger.ZERO, cached().getShipment().getTotalFunded());
    }

    @Test
    @DisplayName("A confirmation that does not arrive in time is INDETERMINATE")
    void confirmationTimeout() {
        ledger.withAllowance(INVESTOR, CONTRACT, tokens(1000));
        ledger.holdConfirmations();

        ActionResult result = coordinator.execute(ActionRequest.fund(HASH, INVESTOR, tokens(100)));

        assertEquals(ActionOutcome.INDETERMINATE, result.getOutcome());
        assertNotNull(result.getSubmissionRef());
        assertNull(result.getErrorKind());
        assertEquals(BigInteger.ZERO, cached().getShipment().getTotalFunded());
    }

    @Test
    @DisplayName("An approval that is not confirmed in time fails without submitting the action")
    void approvalTimeoutIsNotIndeterminate() {
        ledger.holdConfirmations();

        ActionResult result = coordinator.execute(ActionRequest.fund(HASH, INVESTOR, tokens(100)));

        assertEquals(ActionOutcome.FAILED, result.getOutcome());
        assertEquals(ErrorKind.UNKNOWN, result.getErrorKind());
        assertEquals("Approval was not confirmed in time; FUND was not submitted", result.getMessage());
        assertNull(result.getSubmissionRef());
        assertEquals(List.of(OperationType.APPROVE), ledger.submittedTypes());
        assertEquals(BigInteger.ZERO, cached().getShipment().getTotalFunded());
    }

    @Test
    @DisplayName("An unreachable ledger after a confirmed approval fails instead of going INDETERMINATE")
    void actionSubmitUnavailableAfterApproval() {
        ledger.failNextSubmitOf(OperationType.FUND, new LedgerUnavailableException("connection refused", null));

        ActionResult result = coordinator.execute(ActionRequest.fund(HASH, INVESTOR, tokens(100)));

        assertEquals(ActionOutcome.FAILED, result.getOutcome());
        assertEquals(ErrorKind.UNKNOWN, result.getErrorKind());
        assertNull(result.getSubmissionRef());
        assertEquals(List.of(OperationType.APPROVE, OperationType.FUND), ledger.submittedTypes());
        assertEquals(BigInteger.ZERO, cached().getShipment().getTotalFunded());
    }

    @Test
    @DisplayName("A revert is classified and keeps the raw text as diagnostic")
    void revertClassified() {
        String raw = "reverted with reason string 'BillOfLading: Trade is settled'";
        ledger.failNextConfirmation(new LedgerRejectedException(LedgerFailure.ofReason(raw)));

        ActionResult result = coordinator.execute(ActionRequest.markReceived(HASH, BUYER));

        assertEquals(ActionOutcome.FAILED, result.getOutcome());
        assertEquals(ErrorKind.ALREADY_SETTLED, result.getErrorKind());
        assertEquals(raw, result.getDiagnostic());
        assertEquals(1, result.getAttempts());
    }

    @Test
    @DisplayName("The offer id emitted by the ledger is returned and cached")
    void createOfferUsesEmittedId() {
        ledger.withAllowance(INVESTOR, CONTRACT, tokens(1000));
        ledger.emitOfferId(7L);

        ActionResult result = coordinator.execute(ActionRequest.createOffer(HASH, INVESTOR, tokens(200), 500));

        assertTrue(result.isConfirmed());
        assertEquals(7L, result.getOfferId());
        assertEquals(7L, cached().getOffers().get(0).getOfferId());
        assertFalse(cached().getOffers().get(0).isAccepted());
    }

    @Test
    @DisplayName("The seller enabling funding a second time is told funding is already enabled")
    void enableFundingTwiceMessage() {
        ActionResult result = coordinator.execute(ActionRequest.enableFunding(HASH, SELLER));

        assertEquals(ActionOutcome.FAILED, result.getOutcome());
        assertEquals(ErrorKind.UNAUTHORIZED, result.getErrorKind());
        assertEquals("Funding is already enabled for this shipment", result.getMessage());
        assertTrue(ledger.submittedOperations().isEmpty());
    }

    @Test
    @DisplayName("An unknown shipment is NOT_FOUND without any ledger call")
    void unknownShipment() {
        ActionResult result = coordinator.execute(ActionRequest.markReceived("0x" + "cd".repeat(32), BUYER));

        assertEquals(ErrorKind.NOT_FOUND, result.getErrorKind());
        assertTrue(ledger.submittedOperations().isEmpty());
    }

    @Test
    @DisplayName("An unreachable ledger before submission fails with UNKNOWN")
    void unavailableBeforeSubmit() {
        ledger.failNextSubmit(new LedgerUnavailableException("connection refused", null));

        ActionResult result = coordinator.execute(ActionRequest.markReceived(HASH, BUYER));

        assertEquals(ActionOutcome.FAILED, result.getOutcome());
        assertEquals(ErrorKind.UNKNOWN, result.getErrorKind());
    }

    @Test
    @DisplayName("Sequence keys ignore address case")
    void sequenceKeyIgnoresCase() {
        assertEquals(TransactionCoordinator.sequenceKey(ActionRequest.markReceived(HASH, BUYER.toUpperCase())),
                TransactionCoordinator.sequenceKey(ActionRequest.markReceived(HASH.toUpperCase(), BUYER)));
    }
}
