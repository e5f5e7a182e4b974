package com.flagship.trade_ledger.posting;

import lombok.Value;

import java.util.List;

/**
 * Per-account outcomes of one apply or reverse, grouped by outcome.
 */
@Value
public class BalanceUpdateReport {

    public static final BalanceUpdateReport EMPTY = new BalanceUpdateReport(List.of(), List.of(), List.of());

    List<BalanceUpdateResult> applied;
    List<BalanceUpdateResult> skipped;
    List<BalanceUpdateResult> failed;

    public static BalanceUpdateReport of(List<BalanceUpdateResult> results) {
        return new BalanceUpdateReport(
            filter(results, BalanceUpdateResult.Outcome.APPLIED),
            filter(results, BalanceUpdateResult.Outcome.SKIPPED),
            filter(results, BalanceUpdateResult.Outcome.FAILED)
        );
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }

    public int total() {
        return applied.size() + skipped.size() + failed.size();
    }

    private static List<BalanceUpdateResult> filter(List<BalanceUpdateResult> results,
                                                    BalanceUpdateResult.Outcome outcome) {
        return results.stream().filter(r -> r.getOutcome() == outcome).toList();
    }
}
