package com.flagship.trade_finance.validation;

import com.flagship.trade_finance.action.ActionRequest;
import com.flagship.trade_finance.error.ActionRejectedException;
import com.flagship.trade_finance.error.ErrorKind;
import com.flagship.trade_finance.lifecycle.LifecycleStage;
import com.flagship.trade_finance.lifecycle.LifecycleStateMachine;
import com.flagship.trade_finance.offer.FundingOffer;
import com.flagship.trade_finance.offer.OfferBook;
import com.flagship.trade_finance.reconcile.ShipmentSnapshot;
import com.flagship.trade_finance.shipment.Shipment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Rejects actions before anything is submitted to the ledger.
 *
 * Checks per action:
 * - ENABLE_FUNDING: seller; nothing funded yet; stage MINTED
 * - FUND: positive amount; funding enabled and not settled; fits declared value;
 *   native balance covers the reserve; token balance covers the amount
 * - CREATE_OFFER: positive amount; funding enabled; amount within remaining capacity
 * - ACCEPT_OFFER: the offer book's acceptance rules; investor balance and
 *   allowance both cover the principal
 * - PAY: buyer; funding enabled; amount equals declared value exactly;
 *   buyer balance covers it
 * - MARK_RECEIVED: buyer; not settled
 * - REDEEM: claim-token balance above zero; repayments available; not settled
 *
 * For FUND, CREATE_OFFER and PAY a short allowance is not a rejection: the
 * result asks for an approve step instead.
 */
@Component
@Slf4j
public class PreconditionValidator {

    private final LifecycleStateMachine lifecycle;
    private final BigInteger minNativeReserve;

    public PreconditionValidator(LifecycleStateMachine lifecycle,
                                 @Value("${coordinator.min-native-reserve:1000000000000000}") BigInteger minNativeReserve) {
        this.lifecycle = lifecycle;
        this.minNativeReserve = minNativeReserve;
    }

    public ValidationResult validate(ActionRequest request, ValidationContext context) {
        if (request == null || request.getType() == null) {
            throw new IllegalArgumentException("Action request and type are required");
        }
        if (context == null || context.getSnapshot() == null || context.getSnapshot().isProvisional()) {
            return ValidationResult.reject(ErrorKind.NOT_FOUND, "Shipment " + request.getShipmentId() + " is not known");
        }
        if (request.getCaller() == null || request.getCaller().isBlank()) {
            return ValidationResult.reject(ErrorKind.UNAUTHORIZED, "No acting account");
        }

        ShipmentSnapshot snapshot = context.getSnapshot();
        AccountSnapshot caller = context.getCaller();

        return switch (request.getType()) {
            case ENABLE_FUNDING -> validateEnableFunding(request, snapshot.getShipment());
            case FUND -> validateFund(request, snapshot.getShipment(), caller);
            case CREATE_OFFER -> validateCreateOffer(request, snapshot, caller);
            case ACCEPT_OFFER -> validateAcceptOffer(request, snapshot, context.getOfferInvestor());
            case PAY -> validatePay(request, snapshot.getShipment(), caller);
            case MARK_RECEIVED -> validateMarkReceived(request, snapshot.getShipment());
            case REDEEM -> validateRedeem(request, snapshot);
        };
    }

    private ValidationResult validateEnableFunding(ActionRequest request, Shipment shipment) {
        if (!shipment.isSeller(request.getCaller())) {
            return ValidationResult.reject(ErrorKind.UNAUTHORIZED, "Only the seller can enable funding");
        }
        LifecycleStage stage = lifecycle.stageOf(shipment);
        if (stage == LifecycleStage.SETTLED) {
            return ValidationResult.reject(ErrorKind.ALREADY_SETTLED, null);
        }
        if (shipment.getTotalFunded().signum() != 0 || stage != LifecycleStage.MINTED) {
            return ValidationResult.reject(ErrorKind.UNAUTHORIZED, "Funding is already enabled for this shipment");
        }
        return ValidationResult.pass();
    }

    private ValidationResult validateFund(ActionRequest request, Shipment shipment, AccountSnapshot caller) {
        BigInteger amount = request.getAmount();
        if (!isPositive(amount)) {
            return ValidationResult.reject(ErrorKind.INVALID_AMOUNT, "Funding amount must be positive");
        }
        ValidationResult open = requireOpenForFunding(shipment);
        if (!open.isOk()) {
            return open;
        }
        if (shipment.getTotalFunded().add(amount).compareTo(shipment.getDeclaredValue()) > 0) {
            return ValidationResult.reject(ErrorKind.EXCEEDS_DECLARED_VALUE,
                    String.format("Remaining capacity is %s", shipment.remainingCapacity()));
        }
        if (caller.getNativeBalance().compareTo(minNativeReserve) < 0) {
            return ValidationResult.reject(ErrorKind.INSUFFICIENT_BALANCE,
                    "Native balance is below the minimum reserve needed to submit");
        }
        if (caller.getTokenBalance().compareTo(amount) < 0) {
            return ValidationResult.reject(ErrorKind.INSUFFICIENT_BALANCE,
                    String.format("Token balance %s is below %s", caller.getTokenBalance(), amount));
        }
        return withApprovalIfNeeded(caller, amount);
    }

    private ValidationResult validateCreateOffer(ActionRequest request, ShipmentSnapshot snapshot,
                                                 AccountSnapshot caller) {
        BigInteger amount = request.getAmount();
        int bps = request.getInterestRateBps() != null ? request.getInterestRateBps() : 0;
        OfferBook book = snapshot.toOfferBook(lifecycle);
        try {
            book.addOffer(request.getCaller(), amount, bps);
        } catch (ActionRejectedException e) {
            return ValidationResult.reject(e.getKind(), e.getMessage());
        }
        if (caller.getTokenBalance().compareTo(amount) < 0) {
            return ValidationResult.reject(ErrorKind.INSUFFICIENT_BALANCE,
                    String.format("Token balance %s is below the offered %s", caller.getTokenBalance(), amount));
        }
        return withApprovalIfNeeded(caller, amount);
    }

    private ValidationResult validateAcceptOffer(ActionRequest request, ShipmentSnapshot snapshot,
                                                 AccountSnapshot investor) {
        if (request.getOfferId() == null) {
            return ValidationResult.reject(ErrorKind.NOT_FOUND, "No offer id given");
        }
        OfferBook book = snapshot.toOfferBook(lifecycle);
        FundingOffer accepted;
        try {
            accepted = book.accept(request.getOfferId(), request.getCaller());
        } catch (ActionRejectedException e) {
            return ValidationResult.reject(e.getKind(), e.getMessage());
        }

        BigInteger principal = accepted.getAmount();
        if (investor == null || investor.getTokenBalance().compareTo(principal) < 0) {
            return ValidationResult.reject(ErrorKind.INSUFFICIENT_BALANCE,
                    "The investor does not hold enough tokens to fund this offer");
        }
        if (investor.getAllowance().compareTo(principal) < 0) {
            return ValidationResult.reject(ErrorKind.INSUFFICIENT_ALLOWANCE,
                    "The investor has not approved enough tokens for this offer");
        }
        return ValidationResult.pass();
    }

    private ValidationResult validatePay(ActionRequest request, Shipment shipment, AccountSnapshot caller) {
        if (!shipment.isBuyer(request.getCaller())) {
            return ValidationResult.reject(ErrorKind.UNAUTHORIZED, "Only the buyer can pay");
        }
        ValidationResult open = requireOpenForFunding(shipment);
        if (!open.isOk()) {
            return open;
        }
        BigInteger amount = request.getAmount();
        if (amount == null || amount.compareTo(shipment.getDeclaredValue()) != 0) {
            return ValidationResult.reject(ErrorKind.INVALID_AMOUNT,
                    String.format("Payment must equal the declared value %s exactly", shipment.getDeclaredValue()));
        }
        if (caller.getTokenBalance().compareTo(amount) < 0) {
            return ValidationResult.reject(ErrorKind.INSUFFICIENT_BALANCE,
                    String.format("Token balance %s is below %s", caller.getTokenBalance(), amount));
        }
        return withApprovalIfNeeded(caller, amount);
    }

    private ValidationResult validateMarkReceived(ActionRequest request, Shipment shipment) {
        if (!shipment.isBuyer(request.getCaller())) {
            return ValidationResult.reject(ErrorKind.UNAUTHORIZED, "Only the buyer can confirm receipt");
        }
        if (lifecycle.isSettled(shipment)) {
            return ValidationResult.reject(ErrorKind.ALREADY_SETTLED, null);
        }
        return ValidationResult.pass();
    }

    private ValidationResult validateRedeem(ActionRequest request, ShipmentSnapshot snapshot) {
        if (snapshot.claimTokenBalance(request.getCaller()).signum() <= 0) {
            return ValidationResult.reject(ErrorKind.INSUFFICIENT_BALANCE, "Nothing to redeem");
        }
        Shipment shipment = snapshot.getShipment();
        if (shipment.getTotalRepaid().signum() <= 0) {
            return ValidationResult.reject(ErrorKind.INSUFFICIENT_BALANCE, "No repayments available yet");
        }
        if (lifecycle.isSettled(shipment)) {
            return ValidationResult.reject(ErrorKind.ALREADY_SETTLED, null);
        }
        return ValidationResult.pass();
    }

    private ValidationResult requireOpenForFunding(Shipment shipment) {
        LifecycleStage stage = lifecycle.stageOf(shipment);
        if (stage == LifecycleStage.SETTLED) {
            return ValidationResult.reject(ErrorKind.ALREADY_SETTLED, null);
        }
        if (stage == LifecycleStage.MINTED) {
            return ValidationResult.reject(ErrorKind.FUNDING_NOT_ENABLED, null);
        }
        return ValidationResult.pass();
    }

    private static ValidationResult withApprovalIfNeeded(AccountSnapshot caller, BigInteger amount) {
        if (caller.getAllowance().compareTo(amount) < 0) {
            return ValidationResult.passWithApproval(amount);
        }
        return ValidationResult.pass();
    }

    private static boolean isPositive(BigInteger amount) {
        return amount != null && amount.signum() > 0;
    }
}
