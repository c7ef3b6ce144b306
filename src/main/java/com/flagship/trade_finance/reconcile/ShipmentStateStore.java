package com.flagship.trade_finance.reconcile;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Cache of shipment snapshots keyed by shipment hash.
 *
 * Readers see an immutable map published through an AtomicReference, so a
 * read observes either the state before or after a write, never a mix.
 * Writers are serialized on a single lock and publish by copy-then-swap.
 * Subscribers are notified after each published change, outside the lock.
 */
@Component
@Slf4j
public class ShipmentStateStore {

    private final AtomicReference<Map<String, ShipmentSnapshot>> entries = new AtomicReference<>(Map.of());
    private final List<Consumer<ShipmentSnapshot>> subscribers = new CopyOnWriteArrayList<>();
    private final Object writeLock = new Object();

    public Optional<ShipmentSnapshot> get(String shipmentId) {
        if (shipmentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get().get(key(shipmentId)));
    }

    /**
     * Authoritative entry only; provisional placeholders are ignored.
     */
    public Optional<ShipmentSnapshot> getAuthoritative(String shipmentId) {
        return get(shipmentId).filter(snapshot -> !snapshot.isProvisional());
    }

    /**
     * All entries, most recently minted first.
     */
    public List<ShipmentSnapshot> list() {
        Collection<ShipmentSnapshot> values = entries.get().values();
        return values.stream()
                .sorted(Comparator.comparing(
                        (ShipmentSnapshot s) -> s.getShipment().getMintedAt(),
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    /**
     * Replaces the entry when its content differs.
     *
     * @return true if a new map was published
     */
    public boolean replaceIfChanged(ShipmentSnapshot snapshot) {
        ShipmentSnapshot published;
        synchronized (writeLock) {
            Map<String, ShipmentSnapshot> current = entries.get();
            ShipmentSnapshot existing = current.get(key(snapshot.getShipmentId()));
            if (snapshot.sameContentAs(existing)) {
                return false;
            }
            published = snapshot;
            swap(current, snapshot);
        }
        notifySubscribers(published);
        return true;
    }

    /**
     * Inserts a provisional entry unless any entry for the id already exists.
     *
     * @return true if inserted
     */
    public boolean putProvisional(ShipmentSnapshot snapshot) {
        if (!snapshot.isProvisional()) {
            throw new IllegalArgumentException("Snapshot is not provisional");
        }
        synchronized (writeLock) {
            Map<String, ShipmentSnapshot> current = entries.get();
            if (current.containsKey(key(snapshot.getShipmentId()))) {
                return false;
            }
            swap(current, snapshot);
        }
        notifySubscribers(snapshot);
        return true;
    }

    /**
     * Applies a confirmed change to an authoritative entry.
     *
     * @return the updated snapshot, or empty if there is no authoritative entry
     */
    public Optional<ShipmentSnapshot> update(String shipmentId, UnaryOperator<ShipmentSnapshot> change) {
        ShipmentSnapshot updated;
        synchronized (writeLock) {
            Map<String, ShipmentSnapshot> current = entries.get();
            ShipmentSnapshot existing = current.get(key(shipmentId));
            if (existing == null || existing.isProvisional()) {
                return Optional.empty();
            }
            updated = change.apply(existing).toBuilder().refreshedAt(Instant.now()).build();
            swap(current, updated);
        }
        notifySubscribers(updated);
        return Optional.of(updated);
    }

    /**
     * Registers a listener for published changes.
     *
     * @return handle that removes the listener
     */
    public Runnable subscribe(Consumer<ShipmentSnapshot> listener) {
        subscribers.add(listener);
        return () -> subscribers.remove(listener);
    }

    public int size() {
        return entries.get().size();
    }

    private void swap(Map<String, ShipmentSnapshot> current, ShipmentSnapshot snapshot) {
        Map<String, ShipmentSnapshot> next = new HashMap<>(current);
        next.put(key(snapshot.getShipmentId()), snapshot);
        entries.set(Map.copyOf(next));
    }

    private void notifySubscribers(ShipmentSnapshot snapshot) {
        for (Consumer<ShipmentSnapshot> subscriber : subscribers) {
            try {
                subscriber.accept(snapshot);
            } catch (RuntimeException e) {
                log.warn("State store subscriber failed for shipment {}: {}",
                        snapshot.getShipmentId(), e.getMessage());
            }
        }
    }

    private static String key(String shipmentId) {
        return shipmentId.toLowerCase(Locale.ROOT);
    }
}
