package com.flagship.trade_finance.trade.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_finance.offer.FundingOffer;
import com.flagship.trade_finance.shipment.TokenAmounts;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class OfferResponse {

    @JsonProperty("offer_id")
    long offerId;

    @JsonProperty("investor")
    String investor;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("interest_rate_bps")
    int interestRateBps;

    @JsonProperty("claim_tokens")
    BigDecimal claimTokens;

    @JsonProperty("accepted")
    boolean accepted;

    public static OfferResponse from(FundingOffer offer, TokenAmounts tokens) {
        return OfferResponse.builder()
                .offerId(offer.getOfferId())
                .investor(offer.getInvestor())
                .amount(tokens.toTokens(offer.getAmount()))
                .interestRateBps(offer.getInterestRateBps())
                .claimTokens(tokens.toTokens(offer.claimTokens()))
                .accepted(offer.isAccepted())
                .build();
    }
}
