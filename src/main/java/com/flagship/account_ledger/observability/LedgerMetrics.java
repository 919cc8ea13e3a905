package com.flagship.account_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for provisioning and money movement.
 *
 * - ledger.movements{operation,status}: deposits, withdrawals and transfers by outcome
 * - ledger.provisioning{status}: account provisioning outcomes
 * - ledger.compensations{status}: compensating identity deletes
 * - ledger.balance.degraded: balance reads answered with 0 because the engine failed
 * - ledger.operation.latency{operation}: time per operation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMovement(String operation, String status) {
        registry.counter("ledger.movements",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordProvisioning(String status) {
        registry.counter("ledger.provisioning", "status", sanitizeTag(status)).increment();
    }

    public void recordCompensation(boolean succeeded) {
        registry.counter("ledger.compensations", "status", succeeded ? "success" : "failure").increment();
    }

    public void recordDegradedBalanceRead() {
        registry.counter("ledger.balance.degraded").increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Keeps tag values short and free of special characters to bound cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
