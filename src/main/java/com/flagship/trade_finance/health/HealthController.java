package com.flagship.trade_finance.health;

import com.flagship.trade_finance.reconcile.BalanceReconciler;
import com.flagship.trade_finance.reconcile.ShipmentStateStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint that needs no authorization. Reports the database plus
 * the size and polling state of the shipment cache.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final ShipmentStateStore stateStore;
    private final BalanceReconciler reconciler;

    public HealthController(DataSource dataSource, ShipmentStateStore stateStore, BalanceReconciler reconciler) {
        this.dataSource = dataSource;
        this.stateStore = stateStore;
        this.reconciler = reconciler;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("cachedShipments", stateStore.size());
        response.put("polling", reconciler.isPolling());

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
