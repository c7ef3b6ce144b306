package com.flagship.trade_finance.ledger;

import lombok.Value;

/**
 * Confirmation of a submitted operation.
 *
 * {@code emittedOfferId} is set only for offer creation, from the event the
 * contract emits.
 */
@Value
public class LedgerReceipt {
    SubmissionRef ref;
    long blockNumber;
    int confirmations;
    Long emittedOfferId;
}
