package com.flagship.trade_finance.trade.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_finance.action.ActionOutcome;
import com.flagship.trade_finance.action.ActionResult;
import com.flagship.trade_finance.action.ActionType;
import com.flagship.trade_finance.error.ErrorKind;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an action request. {@code message} is meant for display;
 * {@code diagnostic} carries the raw ledger text, if any.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionResultResponse {

    @JsonProperty("outcome")
    ActionOutcome outcome;

    @JsonProperty("action")
    ActionType action;

    @JsonProperty("shipment_id")
    String shipmentId;

    @JsonProperty("submission_ref")
    String submissionRef;

    @JsonProperty("confirmations")
    int confirmations;

    @JsonProperty("error_kind")
    ErrorKind errorKind;

    @JsonProperty("message")
    String message;

    @JsonProperty("diagnostic")
    String diagnostic;

    @JsonProperty("attempts")
    int attempts;

    @JsonProperty("offer_id")
    Long offerId;

    public static ActionResultResponse from(ActionResult result) {
        return ActionResultResponse.builder()
                .outcome(result.getOutcome())
                .action(result.getType())
                .shipmentId(result.getShipmentId())
                .submissionRef(result.getSubmissionRef())
                .confirmations(result.getConfirmations())
                .errorKind(result.getErrorKind())
                .message(result.getMessage())
                .diagnostic(result.getDiagnostic())
                .attempts(result.getAttempts())
                .offerId(result.getOfferId())
                .build();
    }
}
