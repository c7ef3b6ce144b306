package com.flagship.trade_finance.query;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistrationReceipt {
    boolean success;
    String bolHash;
    @JsonAlias("billOfLadingAddress")
    String contractAddress;
    String transactionHash;
    String message;
}
