package com.flagship.trade_finance.ledger;

import java.math.BigInteger;

/**
 * Narrow interface to the external value-transfer ledger.
 *
 * Signing happens behind this interface; callers only name the acting account.
 * Reads never change ledger state. All calls may block.
 */
public interface LedgerClient {

    /**
     * Settlement-token balance of {@code holder}.
     */
    BigInteger readBalance(String holder);

    /**
     * Native (fee) balance of {@code holder}.
     */
    BigInteger readNativeBalance(String holder);

    BigInteger readAllowance(String holder, String spender);

    BigInteger readClaimTokenBalance(String shipmentId, String holder);

    ContractState readContractState(String shipmentId);

    /**
     * Signs and submits the operation.
     *
     * @throws LedgerRejectedException if the ledger refuses it outright
     */
    SubmissionRef submit(LedgerOperation operation);

    /**
     * Blocks until the operation has {@code confirmations} confirmations.
     *
     * @throws LedgerRejectedException if the operation reverted
     */
    LedgerReceipt awaitConfirmation(SubmissionRef ref, int confirmations);
}
