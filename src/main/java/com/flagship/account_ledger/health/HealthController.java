package com.flagship.account_ledger.health;

import com.flagship.account_ledger.ledger.MasterAccountBootstrap;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health endpoint: database connectivity and master account readiness.
 * A degraded master account bootstrap is reported but does not make the service DOWN.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final MasterAccountBootstrap bootstrap;

    public HealthController(DataSource dataSource, MasterAccountBootstrap bootstrap) {
        this.dataSource = dataSource;
        this.bootstrap = bootstrap;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");
        response.put("masterAccounts", bootstrap.getUnresolvedAccounts().isEmpty() ? "READY" : "DEGRADED");

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
            return false;
        }
    }
}
