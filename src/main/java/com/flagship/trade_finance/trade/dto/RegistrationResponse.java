package com.flagship.trade_finance.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_finance.query.RegistrationReceipt;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RegistrationResponse {

    @JsonProperty("bol_hash")
    String bolHash;

    @JsonProperty("contract_address")
    String contractAddress;

    @JsonProperty("transaction_hash")
    String transactionHash;

    @JsonProperty("message")
    String message;

    public static RegistrationResponse from(RegistrationReceipt receipt) {
        return RegistrationResponse.builder()
                .bolHash(receipt.getBolHash())
                .contractAddress(receipt.getContractAddress())
                .transactionHash(receipt.getTransactionHash())
                .message(receipt.getMessage())
                .build();
    }
}
