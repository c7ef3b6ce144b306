package com.flagship.trade_finance.action;

import com.flagship.trade_finance.error.ClassifiedError;
import com.flagship.trade_finance.error.ErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an orchestrated action.
 *
 * A confirmed result carries the submission reference and confirmation count.
 * A failed result carries the error kind with a human-readable message;
 * raw ledger text is only kept in {@code diagnostic}. An indeterminate result
 * carries the reference of the operation that did not confirm in time.
 */
@Value
@Builder(toBuilder = true)
public class ActionResult {
    ActionOutcome outcome;
    ActionType type;
    String shipmentId;
    String submissionRef;
    int confirmations;
    ErrorKind errorKind;
    String message;
    String diagnostic;
    int attempts;
    Long offerId;

    public static ActionResult confirmed(ActionRequest request, String submissionRef, int confirmations,
                                         int attempts, Long offerId) {
        return ActionResult.builder()
                .outcome(ActionOutcome.CONFIRMED)
                .type(request.getType())
                .shipmentId(request.getShipmentId())
                .submissionRef(submissionRef)
                .confirmations(confirmations)
                .attempts(attempts)
                .offerId(offerId)
                .build();
    }

    public static ActionResult rejected(ActionRequest request, ErrorKind kind, String message, int attempts) {
        return ActionResult.builder()
                .outcome(ActionOutcome.FAILED)
                .type(request.getType())
                .shipmentId(request.getShipmentId())
                .errorKind(kind)
                .message(message != null ? message : kind.getDefaultMessage())
                .attempts(attempts)
                .offerId(request.getOfferId())
                .build();
    }

    public static ActionResult failed(ActionRequest request, ClassifiedError error, int attempts) {
        return ActionResult.builder()
                .outcome(ActionOutcome.FAILED)
                .type(request.getType())
                .shipmentId(request.getShipmentId())
                .errorKind(error.getKind())
                .message(error.getMessage())
                .diagnostic(error.getDiagnostic())
                .attempts(attempts)
                .offerId(request.getOfferId())
                .build();
    }

    public static ActionResult indeterminate(ActionRequest request, String submissionRef, int attempts) {
        return ActionResult.builder()
                .outcome(ActionOutcome.INDETERMINATE)
                .type(request.getType())
                .shipmentId(request.getShipmentId())
                .submissionRef(submissionRef)
                .message("Not confirmed in time. The operation may still confirm; recheck after the next refresh.")
                .attempts(attempts)
                .offerId(request.getOfferId())
                .build();
    }

    public boolean isConfirmed() {
        return outcome == ActionOutcome.CONFIRMED;
    }
}
