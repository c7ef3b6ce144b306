package com.flagship.trade_finance.reconcile;

import com.flagship.trade_finance.ledger.ContractState;
import com.flagship.trade_finance.offer.FundingOffer;
import com.flagship.trade_finance.query.OfferRecord;
import com.flagship.trade_finance.query.ShipmentRecord;
import com.flagship.trade_finance.shipment.Shipment;
import com.flagship.trade_finance.shipment.TokenAmounts;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * Builds domain values from query-service records, overlaying the ledger's
 * contract state where the two disagree.
 */
@Component
@RequiredArgsConstructor
public class ShipmentRecordMapper {

    private final TokenAmounts tokenAmounts;

    public Shipment toShipment(ShipmentRecord record, ContractState state) {
        Shipment.ShipmentBuilder builder = Shipment.builder()
                .bolHash(record.getBolHash())
                .contractAddress(record.getContractAddress())
                .seller(record.getSeller())
                .buyer(record.getBuyer())
                .carrier(record.getCarrier())
                .blNumber(record.getBlNumber())
                .documentUrl(record.getPdfUrl())
                .declaredValue(tokenAmounts.parseTokens(record.getDeclaredValue()))
                .totalFunded(tokenAmounts.parseTokens(record.getTotalFunded()))
                .totalPaid(tokenAmounts.parseTokens(record.getTotalPaid()))
                .totalRepaid(tokenAmounts.parseTokens(record.getTotalRepaid()))
                .mintedAt(parseInstant(record.getMintedAt()))
                .fundingEnabledAt(parseInstant(record.getFundingEnabledAt()))
                .arrivedAt(parseInstant(record.getArrivedAt()))
                .paidAt(parseInstant(record.getPaidAt()))
                .settledAt(parseInstant(record.getSettledAt()));

        if (state != null) {
            // Ledger amounts are the source of truth
            if (state.getDeclaredValue() != null) {
                builder.declaredValue(state.getDeclaredValue());
            }
            if (state.getTotalFunded() != null) {
                builder.totalFunded(state.getTotalFunded());
            }
            if (state.getTotalPaid() != null) {
                builder.totalPaid(state.getTotalPaid());
            }
            if (state.getTotalRepaid() != null) {
                builder.totalRepaid(state.getTotalRepaid());
            }
            if (state.getContractAddress() != null) {
                builder.contractAddress(state.getContractAddress());
            }
            if (state.getSeller() != null) {
                builder.seller(state.getSeller());
            }
            if (state.getBuyer() != null) {
                builder.buyer(state.getBuyer());
            }
        }
        return builder.build();
    }

    public FundingOffer toOffer(String shipmentId, OfferRecord record, Set<Long> acceptedOnLedger) {
        boolean accepted = record.isAccepted() || acceptedOnLedger.contains(record.getOfferId());
        return new FundingOffer(shipmentId, record.getOfferId(), record.getInvestor(),
                tokenAmounts.parseTokens(record.getAmount()), record.getInterestRateBps(), accepted);
    }

    /**
     * Accepts ISO-8601 with or without offset; a bare local time is taken as UTC.
     */
    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        }
    }
}
