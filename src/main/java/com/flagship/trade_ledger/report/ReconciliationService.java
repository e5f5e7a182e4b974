package com.flagship.trade_ledger.report;

import com.flagship.trade_ledger.account.AccountSnapshot;
import com.flagship.trade_ledger.observability.LedgerMetrics;
import com.flagship.trade_ledger.replay.ReplaySnapshot;
import com.flagship.trade_ledger.replay.TransactionReplayAggregator;
import com.flagship.trade_ledger.replay.VoucherBalanceMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Compares the two sources of truth: the live outstanding balance kept by
 * posting, and the balance replayed from transactions as of today.
 *
 * Drift is expected, not a posting fault, in these cases:
 * - trips and stock movements reach customer and vendor replays but never
 *   touch the stored outstanding balance
 * - a Payment/Receipt naming a vendor party moves the vendor's linked ledger
 *   when posted, while the replay moves the vendor and leaves that ledger alone
 * - a Journal/Contra entry that posting resolved by slug or to a customer or
 *   vendor is replayed only under the exact ledger name written on it
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final ReplaySnapshotLoader snapshotLoader;
    private final TransactionReplayAggregator aggregator;
    private final LedgerMetrics metrics;

    public ReconciliationReport reconcile() {
        ReplaySnapshot snapshot = snapshotLoader.load(snapshotLoader.today());
        VoucherBalanceMap voucherMap = aggregator.buildVoucherBalanceMap(snapshot.getVouchers(), snapshot.getCutoff());

        List<AccountDrift> drifted = new ArrayList<>();
        AtomicInteger errors = new AtomicInteger();

        for (AccountSnapshot ledger : snapshot.getLedgers()) {
            check(ledger, () -> ledger.getOpening().toSigned()
                .add(aggregator.ledgerBalance(ledger, voucherMap).balance()), drifted, errors);
        }
        for (AccountSnapshot customer : snapshot.getCustomers()) {
            check(customer, () -> aggregator.customerBalance(
                customer, snapshot.getVouchers(), snapshot.getTrips(), snapshot.getCutoff()), drifted, errors);
        }
        for (AccountSnapshot vendor : snapshot.getVendors()) {
            check(vendor, () -> aggregator.vendorBalance(vendor, snapshot.getVouchers(), snapshot.getTrips(),
                snapshot.getStocks(), snapshot.getCutoff()), drifted, errors);
        }

        int checked = snapshot.getLedgers().size() + snapshot.getCustomers().size() + snapshot.getVendors().size();
        if (!drifted.isEmpty()) {
            metrics.recordReconciliationDrift(drifted.size());
            log.warn("Reconciliation found drifted accounts: asOf={}, checked={}, drifted={}",
                snapshot.getAsOf(), checked, drifted.size());
        } else {
            log.info("Reconciliation clean: asOf={}, checked={}", snapshot.getAsOf(), checked);
        }
        return new ReconciliationReport(snapshot.getAsOf(), checked, List.copyOf(drifted), errors.get());
    }

    private void check(AccountSnapshot account, Supplier<BigDecimal> replay,
                       List<AccountDrift> drifted, AtomicInteger errors) {
        BigDecimal replayed;
        try {
            replayed = replay.get();
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            metrics.incrementComputationErrors();
            log.error("Replay failed during reconciliation: kind={}, accountId={}, error={}",
                account.getKind(), account.getId(), e.getMessage());
            return;
        }
        BigDecimal outstanding = account.getOutstanding().toSigned();
        BigDecimal difference = outstanding.subtract(replayed);
        if (difference.abs().compareTo(BalanceSheetService.IMBALANCE_TOLERANCE) > 0) {
            drifted.add(new AccountDrift(account.getId(), account.getKind(), account.getName(),
                outstanding, replayed, difference));
        }
    }
}
