package com.flagship.trade_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for the balance engine.
 *
 * Metrics exposed:
 * - ledger.voucher.posted: vouchers posted, tagged by type and operation
 * - ledger.balance.update: per-account balance updates, tagged by outcome
 * - ledger.computation.errors: balance computations that fell back to zero
 * - ledger.balance_sheet.duration: balance sheet build time
 * - ledger.reconciliation.drift: accounts whose live balance drifted from replay
 */
@Component
public class LedgerMetrics {

    public static final String OUTCOME_APPLIED = "applied";
    public static final String OUTCOME_SKIPPED = "skipped";
    public static final String OUTCOME_FAILED = "failed";

    private final MeterRegistry registry;

    private final Counter computationErrors;
    private final Counter reconciliationDrift;
    private final Counter balanceSheetImbalances;
    private final Timer balanceSheetTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.computationErrors = Counter.builder("ledger.computation.errors")
                .description("Balance computations that failed and contributed zero")
                .register(registry);

        this.reconciliationDrift = Counter.builder("ledger.reconciliation.drift")
                .description("Accounts whose live outstanding balance differs from the replayed balance")
                .register(registry);

        this.balanceSheetImbalances = Counter.builder("ledger.balance_sheet.imbalanced")
                .description("Balance sheets whose assets did not match liabilities plus capital")
                .register(registry);

        this.balanceSheetTimer = Timer.builder("ledger.balance_sheet.duration")
                .description("Time taken to replay and roll up a balance sheet")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Voucher lifecycle ====================

    public void recordVoucherPosted(String voucherType, String operation) {
        registry.counter("ledger.voucher.posted",
                "type", sanitizeTag(voucherType),
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public void recordVoucherLatency(String operation, long durationMs) {
        registry.timer("ledger.voucher.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Balance updates ====================

    /**
     * Records the outcome of one per-account balance update.
     */
    public void recordBalanceUpdate(String accountKind, String outcome) {
        registry.counter("ledger.balance.update",
                "kind", sanitizeTag(accountKind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void incrementComputationErrors() {
        computationErrors.increment();
    }

    // ==================== Reports ====================

    public <T> T timeBalanceSheet(Supplier<T> operation) {
        return balanceSheetTimer.record(operation);
    }

    public void incrementBalanceSheetImbalances() {
        balanceSheetImbalances.increment();
    }

    public void recordReconciliationDrift(int driftedAccounts) {
        reconciliationDrift.increment(driftedAccounts);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
