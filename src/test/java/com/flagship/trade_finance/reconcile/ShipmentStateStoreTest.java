package com.flagship.trade_finance.reconcile;

import com.flagship.trade_finance.shipment.Shipment;
import com.flagship.trade_finance.support.Shipments;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.flagship.trade_finance.support.Shipments.HASH;
import static com.flagship.trade_finance.support.Shipments.tokens;
import static org.junit.jupiter.api.Assertions.*;

class ShipmentStateStoreTest {

    private final ShipmentStateStore store = new ShipmentStateStore();

    @Test
    @DisplayName("Replacing with identical content publishes nothing")
    void identicalContentIsNotPublished() {
        AtomicInteger notifications = new AtomicInteger();
        store.subscribe(snapshot -> notifications.incrementAndGet());

        assertTrue(store.replaceIfChanged(Shipments.snapshot(Shipments.minted(1000))));
        ShipmentSnapshot sameContentLater = Shipments.snapshot(Shipments.minted(1000)).toBuilder()
                .refreshedAt(Instant.now())
                .build();
        assertFalse(store.replaceIfChanged(sameContentLater));

        assertEquals(1, notifications.get());
    }

    @Test
    @DisplayName("Lookups ignore hash case")
    void caseInsensitiveLookup() {
        store.replaceIfChanged(Shipments.snapshot(Shipments.minted(1000)));

        assertTrue(store.get(HASH.toUpperCase()).isPresent());
        assertTrue(store.get(null).isEmpty());
    }

    @Test
    @DisplayName("A provisional entry never overwrites an existing one")
    void provisionalDoesNotOverwrite() {
        store.replaceIfChanged(Shipments.snapshot(Shipments.fundingEnabled(1000)));

        assertFalse(store.putProvisional(ShipmentSnapshot.provisional(Shipments.minted(1000))));
        assertFalse(store.get(HASH).orElseThrow().isProvisional());
    }

    @Test
    @DisplayName("Provisional entries are listed but not authoritative and cannot be updated")
    void provisionalEntries() {
        assertTrue(store.putProvisional(ShipmentSnapshot.provisional(Shipments.minted(1000))));

        assertEquals(1, store.list().size());
        assertTrue(store.getAuthoritative(HASH).isEmpty());
        assertTrue(store.update(HASH, snapshot -> snapshot).isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> store.putProvisional(Shipments.snapshot(Shipments.minted(1000))));
    }

    @Test
    @DisplayName("Update swaps in the changed snapshot and stamps it")
    void updateAppliesChange() {
        store.replaceIfChanged(Shipments.snapshot(Shipments.fundingEnabled(1000)));

        ShipmentSnapshot updated = store.update(HASH, snapshot -> snapshot.toBuilder()
                .shipment(snapshot.getShipment().toBuilder().totalFunded(tokens(10)).build())
                .build()).orElseThrow();

        assertEquals(tokens(10), store.get(HASH).orElseThrow().getShipment().getTotalFunded());
        assertTrue(updated.getRefreshedAt().isAfter(Shipments.T0));
    }

    @Test
    @DisplayName("List is ordered by mint time, newest first")
    void listOrdering() {
        Shipment older = Shipments.minted(10).toBuilder().bolHash("0x01").build();
        Shipment newer = Shipments.minted(10).toBuilder().bolHash("0x02").mintedAt(Instant.parse("2026-04-01T00:00:00Z")).build();
        store.replaceIfChanged(Shipments.snapshot(older));
        store.replaceIfChanged(Shipments.snapshot(newer));

        List<String> ids = store.list().stream().map(ShipmentSnapshot::getShipmentId).toList();

        assertEquals(List.of("0x02", "0x01"), ids);
    }

    @Test
    @DisplayName("A failing subscriber does not stop others or the write")
    void failingSubscriberIsIsolated() {
        AtomicInteger seen = new AtomicInteger();
        store.subscribe(snapshot -> {
            throw new IllegalStateException("listener broke");
        });
        Runnable unsubscribe = store.subscribe(snapshot -> seen.incrementAndGet());

        assertTrue(store.replaceIfChanged(Shipments.snapshot(Shipments.minted(1000))));
        unsubscribe.run();
        store.replaceIfChanged(Shipments.snapshot(Shipments.fundingEnabled(1000)));

        assertEquals(1, seen.get());
        assertEquals(1, store.size());
    }
}
