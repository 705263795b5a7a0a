package com.flagship.club_ledger.health;

import com.flagship.club_ledger.observability.PaymentEventMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness check. Unlike the Actuator health endpoint, this does
 * not require authorization.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final PaymentEventMetrics paymentEventMetrics;
    private final Clock clock;

    public HealthController(DataSource dataSource, PaymentEventMetrics paymentEventMetrics, Clock clock) {
        this.dataSource = dataSource;
        this.paymentEventMetrics = paymentEventMetrics;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        // Last refreshed value; reading the table here would fail along with the database
        response.put("stuckClaims", paymentEventMetrics.stuckClaims());

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
