package com.flagship.trade_finance.lifecycle;

import com.flagship.trade_finance.shipment.Shipment;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Derives a shipment's lifecycle stage from its stage timestamps.
 *
 * The machine performs no I/O and holds no state. Stages are never stored;
 * they are projected from the timestamps maintained by confirmed ledger events.
 *
 * Rules:
 * - The current stage is the latest stage whose timestamp is set
 * - A later timestamp set while an earlier one is null is a data-integrity error
 * - A shipment with no timestamp at all is invalid
 */
@Component
public class LifecycleStateMachine {

    /**
     * Returns the current stage of the shipment.
     *
     * @throws LifecycleIntegrityException if the timestamps violate ordering
     *         or none is set
     */
    public LifecycleStage stageOf(Shipment shipment) {
        if (shipment == null) {
            throw new IllegalArgumentException("Shipment cannot be null");
        }
        Map<LifecycleStage, Instant> timestamps = timestampsOf(shipment);

        LifecycleStage current = null;
        LifecycleStage[] stages = LifecycleStage.values();
        for (int i = stages.length - 1; i >= 0; i--) {
            if (timestamps.get(stages[i]) != null) {
                current = stages[i];
                break;
            }
        }

        if (current == null) {
            throw new LifecycleIntegrityException(shipment.getBolHash(), "no stage timestamp is set");
        }

        for (int i = 0; i < current.ordinal(); i++) {
            if (timestamps.get(stages[i]) == null) {
                throw new LifecycleIntegrityException(shipment.getBolHash(),
                        String.format("%s is set but earlier stage %s is not", current, stages[i]));
            }
        }
        return current;
    }

    /**
     * Funding counts as enabled from FUNDING_ENABLED onwards, including after settlement.
     */
    public boolean hasFundingEnabled(Shipment shipment) {
        return stageOf(shipment).isAtLeast(LifecycleStage.FUNDING_ENABLED);
    }

    public boolean isSettled(Shipment shipment) {
        return stageOf(shipment).isTerminal();
    }

    /**
     * Checks that {@code next} does not regress any stage already reached by {@code previous}.
     * Used when replacing cached state with a fresh read.
     */
    public void verifyProgression(Shipment previous, Shipment next) {
        if (previous == null || next == null) {
            return;
        }
        LifecycleStage before = stageOf(previous);
        LifecycleStage after = stageOf(next);
        if (after.ordinal() < before.ordinal()) {
            throw new LifecycleIntegrityException(next.getBolHash(),
                    String.format("stage regressed from %s to %s", before, after));
        }
    }

    private static Map<LifecycleStage, Instant> timestampsOf(Shipment shipment) {
        Map<LifecycleStage, Instant> timestamps = new EnumMap<>(LifecycleStage.class);
        timestamps.put(LifecycleStage.MINTED, shipment.getMintedAt());
        timestamps.put(LifecycleStage.FUNDING_ENABLED, shipment.getFundingEnabledAt());
        timestamps.put(LifecycleStage.ARRIVED, shipment.getArrivedAt());
        timestamps.put(LifecycleStage.PAID, shipment.getPaidAt());
        timestamps.put(LifecycleStage.SETTLED, shipment.getSettledAt());
        return timestamps;
    }
}
