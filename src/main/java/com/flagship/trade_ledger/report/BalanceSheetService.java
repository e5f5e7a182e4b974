package com.flagship.trade_ledger.report;

import com.flagship.trade_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Builds balance sheets by replaying transactions. Stored outstanding
 * balances are reported for information only and never feed the totals.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceSheetService {

    static final BigDecimal IMBALANCE_TOLERANCE = new BigDecimal("0.01");

    private final ReplaySnapshotLoader snapshotLoader;
    private final BalanceRollupEngine rollupEngine;
    private final LedgerMetrics metrics;

    /**
     * @param asOf inclusive report date; today in the report zone when null
     */
    public BalanceSheet balanceSheet(LocalDate asOf) {
        LocalDate date = asOf != null ? asOf : snapshotLoader.today();
        return metrics.timeBalanceSheet(() -> build(date));
    }

    private BalanceSheet build(LocalDate asOf) {
        BalanceSheet sheet = rollupEngine.rollUp(snapshotLoader.load(asOf));
        BalanceSheet.Totals totals = sheet.getTotals();

        if (totals.getBalance().abs().compareTo(IMBALANCE_TOLERANCE) > 0) {
            metrics.incrementBalanceSheetImbalances();
            log.warn("Balance sheet does not balance: asOf={}, totalAssets={}, totalLiabilitiesAndCapital={}, difference={}",
                asOf, totals.getTotalAssets(), totals.getTotalLiabilitiesAndCapital(), totals.getBalance());
        }
        if (!sheet.getDetachedGroups().isEmpty()) {
            log.warn("Balance sheet built over a cyclic group hierarchy: asOf={}, detachedGroups={}",
                asOf, sheet.getDetachedGroups());
        }
        log.info("Balance sheet built: asOf={}, totalAssets={}, totalLiabilities={}, capital={}, computationErrors={}",
            asOf, totals.getTotalAssets(), totals.getTotalLiabilities(), sheet.getCapital().getAmount(),
            sheet.getComputationErrors());
        return sheet;
    }
}
