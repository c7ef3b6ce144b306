package com.flagship.trade_finance.trade;

import com.flagship.trade_finance.action.ActionOutcome;
import com.flagship.trade_finance.action.ActionRequest;
import com.flagship.trade_finance.action.ActionResult;
import com.flagship.trade_finance.action.ActionType;
import com.flagship.trade_finance.error.ErrorKind;
import com.flagship.trade_finance.shipment.Shipment;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Audit record of one orchestrated request.
 *
 * Immutable; {@link #complete(ActionResult)} returns a new instance carrying the
 * outcome. The idempotency key itself is a persistence concern and lives on the
 * entity only.
 */
@Value
@Builder(toBuilder = true)
public class ActionRecord {
    UUID id;
    ActionType actionType;
    String shipmentId;
    String account;
    BigInteger amount;
    Long offerId;
    Integer interestRateBps;
    ActionRecordStatus status;
    ErrorKind errorKind;
    String message;
    String diagnostic;
    String submissionRef;
    int confirmations;
    int attempts;
    Instant createdAt;
    Instant updatedAt;

    public static ActionRecord pending(ActionRequest request) {
        return ActionRecord.builder()
                .id(UUID.randomUUID())
                .actionType(request.getType())
                .shipmentId(request.getShipmentId())
                .account(request.getCaller())
                .amount(request.getAmount())
                .offerId(request.getOfferId())
                .interestRateBps(request.getInterestRateBps())
                .status(ActionRecordStatus.PENDING)
                .build();
    }

    /**
     * Applies a coordinator outcome.
     *
     * @throws IllegalStateException if the record already holds a final outcome
     */
    public ActionRecord complete(ActionResult result) {
        if (status.isFinal()) {
            throw new IllegalStateException("Action record " + id + " is already " + status);
        }
        return toBuilder()
                .status(ActionRecordStatus.from(result.getOutcome()))
                .errorKind(result.getErrorKind())
                .message(result.getMessage())
                .diagnostic(result.getDiagnostic())
                .submissionRef(result.getSubmissionRef() != null ? result.getSubmissionRef() : submissionRef)
                .confirmations(result.getConfirmations())
                .attempts(Math.max(attempts, result.getAttempts()))
                .offerId(result.getOfferId() != null ? result.getOfferId() : offerId)
                .build();
    }

    /**
     * Rebuilds the result originally returned for this record, for replays.
     *
     * @throws IllegalStateException while the record is still PENDING
     */
    public ActionResult toResult() {
        if (status == ActionRecordStatus.PENDING) {
            throw new IllegalStateException("Action " + id + " is still in progress");
        }
        return ActionResult.builder()
                .outcome(ActionOutcome.valueOf(status.name()))
                .type(actionType)
                .shipmentId(shipmentId)
                .submissionRef(submissionRef)
                .confirmations(confirmations)
                .errorKind(errorKind)
                .message(message)
                .diagnostic(diagnostic)
                .attempts(attempts)
                .offerId(offerId)
                .build();
    }

    public ActionRequest toRequest() {
        return ActionRequest.builder()
                .type(actionType)
                .shipmentId(shipmentId)
                .caller(account)
                .amount(amount)
                .offerId(offerId)
                .interestRateBps(interestRateBps)
                .build();
    }

    /**
     * Whether a repeated request with the same key asks for the same thing.
     */
    public boolean describes(ActionRequest request) {
        return actionType == request.getType()
                && shipmentId.equalsIgnoreCase(request.getShipmentId())
                && Shipment.sameAccount(account, request.getCaller())
                && Objects.equals(amount, request.getAmount())
                && (actionType == ActionType.CREATE_OFFER || Objects.equals(offerId, request.getOfferId()));
    }
}
