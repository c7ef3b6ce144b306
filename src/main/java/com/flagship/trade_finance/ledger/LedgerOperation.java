package com.flagship.trade_finance.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * A single operation to be signed and submitted on behalf of {@code account}.
 * Unused arguments are null.
 */
@Value
@Builder
public class LedgerOperation {
    OperationType type;
    String account;
    String shipmentId;
    String contractAddress;
    BigInteger amount;
    Long offerId;
    Integer interestRateBps;
    String spender;

    public static LedgerOperation approve(String account, String spender, BigInteger amount, String shipmentId) {
        return LedgerOperation.builder()
                .type(OperationType.APPROVE)
                .account(account)
                .spender(spender)
                .amount(amount)
                .shipmentId(shipmentId)
                .build();
    }
}
