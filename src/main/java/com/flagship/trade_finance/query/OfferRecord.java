package com.flagship.trade_finance.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Funding offer as indexed by the query service.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class OfferRecord {
    @JsonProperty("bol_hash")
    String bolHash;
    @JsonProperty("offer_id")
    long offerId;
    @JsonProperty("investor")
    String investor;
    @JsonProperty("amount")
    String amount;
    @JsonProperty("interest_rate_bps")
    int interestRateBps;
    @JsonProperty("claim_tokens")
    String claimTokens;
    @JsonProperty("accepted")
    boolean accepted;
}
