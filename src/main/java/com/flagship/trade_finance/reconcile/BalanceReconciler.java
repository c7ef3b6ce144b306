package com.flagship.trade_finance.reconcile;

import com.flagship.trade_finance.ledger.ContractState;
import com.flagship.trade_finance.ledger.LedgerClient;
import com.flagship.trade_finance.lifecycle.LifecycleIntegrityException;
import com.flagship.trade_finance.lifecycle.LifecycleStateMachine;
import com.flagship.trade_finance.observability.ActionMetrics;
import com.flagship.trade_finance.offer.FundingOffer;
import com.flagship.trade_finance.query.OfferRecord;
import com.flagship.trade_finance.query.ShipmentFilter;
import com.flagship.trade_finance.query.ShipmentQueryClient;
import com.flagship.trade_finance.query.ShipmentRecord;
import com.flagship.trade_finance.shipment.Shipment;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps the {@link ShipmentStateStore} consistent with the ledger.
 *
 * Each refresh reads the indexed record and offers from the query service,
 * overlays the ledger's contract state and claim-token balances, and publishes
 * the result as one snapshot. Refreshing twice with nothing confirmed in
 * between publishes nothing the second time.
 *
 * A periodic task refreshes every indexed shipment. It is owned here and has a
 * single handle; refresh failures are logged and the stale entry is kept.
 * Lifecycle integrity violations are never repaired: they propagate.
 */
@Component
@Slf4j
public class BalanceReconciler {

    private final ShipmentQueryClient queryClient;
    private final LedgerClient ledgerClient;
    private final ShipmentStateStore store;
    private final ShipmentRecordMapper mapper;
    private final LifecycleStateMachine lifecycle;
    private final ActionMetrics metrics;
    private final TaskScheduler scheduler;
    private final Duration pollInterval;
    private final boolean pollingEnabled;

    private final Object pollingLock = new Object();
    private ScheduledFuture<?> pollingHandle;

    public BalanceReconciler(ShipmentQueryClient queryClient,
                             LedgerClient ledgerClient,
                             ShipmentStateStore store,
                             ShipmentRecordMapper mapper,
                             LifecycleStateMachine lifecycle,
                             ActionMetrics metrics,
                             @Qualifier("reconcilerScheduler") TaskScheduler scheduler,
                             @Value("${reconciler.poll-interval-ms:10000}") long pollIntervalMs,
                             @Value("${reconciler.polling.enabled:true}") boolean pollingEnabled) {
        this.queryClient = queryClient;
        this.ledgerClient = ledgerClient;
        this.store = store;
        this.mapper = mapper;
        this.lifecycle = lifecycle;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.pollingEnabled = pollingEnabled;
    }

    /**
     * Re-reads one shipment and atomically replaces its cached snapshot.
     *
     * @return the cached snapshot after the refresh; empty if the shipment is
     *         unknown to both the cache and the query service
     * @throws LifecycleIntegrityException if the fresh data violates stage ordering
     *         or regresses a stage already observed
     */
    public Optional<ShipmentSnapshot> refresh(String shipmentId) {
        try {
            Optional<ShipmentRecord> record = queryClient.getShipment(shipmentId);
            if (record.isEmpty()) {
                metrics.recordRefresh("not_indexed");
                log.debug("Shipment {} not indexed yet, keeping cached entry", shipmentId);
                return store.get(shipmentId);
            }

            ShipmentSnapshot fresh = readSnapshot(shipmentId, record.get());
            Optional<ShipmentSnapshot> previous = store.getAuthoritative(shipmentId);
            lifecycle.stageOf(fresh.getShipment());
            previous.ifPresent(p -> lifecycle.verifyProgression(p.getShipment(), fresh.getShipment()));

            boolean changed = store.replaceIfChanged(fresh);
            metrics.recordRefresh(changed ? "updated" : "unchanged");
            if (changed) {
                log.debug("Refreshed shipment {}: totalFunded={}, offers={}",
                        shipmentId, fresh.getShipment().getTotalFunded(), fresh.getOffers().size());
            }
            return store.get(shipmentId);

        } catch (LifecycleIntegrityException e) {
            metrics.recordRefresh("integrity_error");
            log.error("Lifecycle integrity violation while refreshing shipment {}: {}", shipmentId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordRefresh("failed");
            log.warn("Refresh of shipment {} failed, keeping cached state: {}", shipmentId, e.getMessage());
            return store.get(shipmentId);
        }
    }

    /**
     * Authoritative snapshot of a shipment, refreshing first when the cache
     * holds none or only a placeholder.
     */
    public Optional<ShipmentSnapshot> getOrRefresh(String shipmentId) {
        Optional<ShipmentSnapshot> cached = store.getAuthoritative(shipmentId);
        if (cached.isPresent()) {
            return cached;
        }
        return refresh(shipmentId).filter(snapshot -> !snapshot.isProvisional());
    }

    /**
     * Inserts a placeholder for a shipment that is not indexed yet. The
     * placeholder never contributes to funded, paid or repaid totals and is
     * replaced by the first authoritative read.
     *
     * @return true if inserted, false if any entry already existed
     */
    public boolean mergeOptimistic(Shipment localEntry) {
        Shipment placeholder = localEntry.toBuilder()
                .totalFunded(BigInteger.ZERO)
                .totalPaid(BigInteger.ZERO)
                .totalRepaid(BigInteger.ZERO)
                .build();
        boolean inserted = store.putProvisional(ShipmentSnapshot.provisional(placeholder));
        if (inserted) {
            log.info("Added provisional entry for shipment {}", localEntry.getBolHash());
        }
        return inserted;
    }

    /**
     * One polling pass: refreshes every indexed shipment plus every cached one
     * the index did not list (provisional entries in particular).
     */
    public void pollOnce() {
        Set<String> ids = new LinkedHashSet<>();
        try {
            for (ShipmentRecord record : queryClient.listShipments(ShipmentFilter.all())) {
                if (record.getBolHash() != null) {
                    ids.add(record.getBolHash());
                }
            }
        } catch (RuntimeException e) {
            metrics.recordRefresh("failed");
            log.warn("Listing shipments failed, refreshing cached entries only: {}", e.getMessage());
        }
        store.list().forEach(snapshot -> ids.add(snapshot.getShipmentId()));

        for (String id : ids) {
            try {
                refresh(id);
            } catch (LifecycleIntegrityException e) {
                // Already logged; keep polling the others
                log.debug("Skipping shipment {} after integrity error", id);
            }
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (pollingEnabled) {
            startPolling();
        } else {
            log.info("Reconciler polling disabled");
        }
    }

    public void startPolling() {
        synchronized (pollingLock) {
            if (pollingHandle != null && !pollingHandle.isDone()) {
                return;
            }
            pollingHandle = scheduler.scheduleAtFixedRate(this::pollSafely, pollInterval);
            log.info("Reconciler polling started every {} ms", pollInterval.toMillis());
        }
    }

    @PreDestroy
    public void stopPolling() {
        synchronized (pollingLock) {
            if (pollingHandle != null) {
                pollingHandle.cancel(false);
                pollingHandle = null;
                log.info("Reconciler polling stopped");
            }
        }
    }

    public boolean isPolling() {
        synchronized (pollingLock) {
            return pollingHandle != null && !pollingHandle.isDone();
        }
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("Reconciler polling pass failed", e);
        }
    }

    private ShipmentSnapshot readSnapshot(String shipmentId, ShipmentRecord record) {
        ContractState state = ledgerClient.readContractState(shipmentId);
        Shipment shipment = mapper.toShipment(record, state);

        Set<Long> acceptedOnLedger = new HashSet<>(state.getAcceptedOfferIds());
        List<OfferRecord> offerRecords = queryClient.listOffers(shipmentId);
        List<FundingOffer> offers = offerRecords.stream()
                .map(offer -> mapper.toOffer(shipment.getBolHash(), offer, acceptedOnLedger))
                .sorted((a, b) -> Long.compare(a.getOfferId(), b.getOfferId()))
                .toList();

        Set<String> holders = new LinkedHashSet<>();
        offers.stream().map(FundingOffer::getInvestor).forEach(holders::add);
        if (shipment.getSeller() != null) {
            holders.add(shipment.getSeller());
        }

        Map<String, BigInteger> balances = new HashMap<>();
        for (String holder : holders) {
            BigInteger balance = ledgerClient.readClaimTokenBalance(shipmentId, holder);
            if (balance != null && balance.signum() > 0) {
                balances.put(holder.toLowerCase(Locale.ROOT), balance);
            }
        }

        return ShipmentSnapshot.builder()
                .shipment(shipment)
                .offers(offers)
                .claimTokenBalances(Map.copyOf(balances))
                .provisional(false)
                .refreshedAt(Instant.now())
                .build();
    }
}
