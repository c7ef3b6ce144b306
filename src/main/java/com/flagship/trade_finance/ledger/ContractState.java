package com.flagship.trade_finance.ledger;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.util.List;

/**
 * Authoritative trade state of one shipment contract, in base units.
 */
@Value
@Builder
@Jacksonized
public class ContractState {
    String shipmentId;
    String contractAddress;
    String seller;
    String buyer;
    BigInteger declaredValue;
    BigInteger totalFunded;
    BigInteger totalPaid;
    BigInteger totalRepaid;
    boolean fundingEnabled;
    boolean settled;
    @Builder.Default
    List<Long> acceptedOfferIds = List.of();
}
