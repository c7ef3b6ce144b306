package com.flagship.trade_finance.validation;

import com.flagship.trade_finance.reconcile.ShipmentSnapshot;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only inputs to validation.
 *
 * {@code offerInvestor} is only read when accepting an offer: the tokens move
 * from the investor, not from the calling seller.
 */
@Value
@Builder
public class ValidationContext {
    ShipmentSnapshot snapshot;
    AccountSnapshot caller;
    AccountSnapshot offerInvestor;
}
