package com.flagship.trade_finance.error;

/**
 * Closed taxonomy of reasons an orchestrated action can fail.
 *
 * Ledger rejections are mapped onto these kinds by {@link ErrorClassifier};
 * precondition failures are reported with the same kinds before anything is
 * submitted.
 */
public enum ErrorKind {

    /**
     * The holder has not granted the shipment contract a large enough spending limit.
     */
    INSUFFICIENT_ALLOWANCE("The spender has not been approved for enough tokens."),

    /**
     * The holder (or the contract) does not hold enough tokens, or there is nothing to redeem.
     */
    INSUFFICIENT_BALANCE("Insufficient token balance for this operation."),

    /**
     * The funding offer was already accepted.
     */
    ALREADY_ACCEPTED("This offer has already been accepted."),

    /**
     * The shipment or offer does not exist.
     */
    NOT_FOUND("The shipment or offer does not exist."),

    /**
     * The caller does not hold the role the action requires.
     */
    UNAUTHORIZED("The caller is not permitted to perform this action."),

    /**
     * Accepting or funding would push total funding past the declared value.
     */
    EXCEEDS_DECLARED_VALUE("This would exceed the declared value of the shipment."),

    /**
     * The trade reached its terminal settled state.
     */
    ALREADY_SETTLED("This trade has already been settled."),

    /**
     * Funding has not been enabled for the shipment.
     */
    FUNDING_NOT_ENABLED("Funding is not enabled for this shipment."),

    /**
     * Transient ordering rejection: operations for one account arrived out of sequence.
     */
    NONCE_CONFLICT("Transaction was sent out of order. Please retry shortly."),

    /**
     * The amount is not acceptable for the action (non-positive, or not the exact payable value).
     * Only raised before submission; never produced from ledger text.
     */
    INVALID_AMOUNT("The amount is not valid for this action."),

    /**
     * Nothing matched. The raw ledger text is preserved as diagnostic detail.
     */
    UNKNOWN("The ledger rejected the operation.");

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    /**
     * Only ordering conflicts are recovered locally.
     */
    public boolean isRetryable() {
        return this == NONCE_CONFLICT;
    }
}
