package com.flagship.trade_ledger.report;

import com.flagship.trade_ledger.account.AccountSnapshot;
import com.flagship.trade_ledger.config.ReportExecutorConfig;
import com.flagship.trade_ledger.group.Group;
import com.flagship.trade_ledger.inventory.InventoryStock;
import com.flagship.trade_ledger.replay.ReplayCutoff;
import com.flagship.trade_ledger.replay.ReplaySnapshot;
import com.flagship.trade_ledger.trip.Trip;
import com.flagship.trade_ledger.voucher.Voucher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Reads everything a balance sheet needs, in parallel, and joins it into
 * one {@link ReplaySnapshot}.
 */
@Component
@Slf4j
public class ReplaySnapshotLoader {

    private final SnapshotReader reader;
    private final ThreadPoolTaskExecutor executor;

    @Value("${ledger.report.zone:UTC}")
    private String zone;

    public ReplaySnapshotLoader(SnapshotReader reader,
                                @Qualifier(ReportExecutorConfig.REPORT_EXECUTOR) ThreadPoolTaskExecutor executor) {
        this.reader = reader;
        this.executor = executor;
    }

    public ZoneId zone() {
        return ZoneId.of(zone);
    }

    public LocalDate today() {
        return LocalDate.now(zone());
    }

    public ReplaySnapshot load(LocalDate asOf) {
        Instant cutoff = ReplayCutoff.endOfDay(asOf, zone());
        long startTime = System.currentTimeMillis();

        CompletableFuture<List<AccountSnapshot>> ledgers = read(reader::ledgers);
        CompletableFuture<List<AccountSnapshot>> customers = read(reader::customers);
        CompletableFuture<List<AccountSnapshot>> vendors = read(reader::vendors);
        CompletableFuture<List<Voucher>> vouchers = read(() -> reader.vouchers(cutoff));
        CompletableFuture<List<Trip>> trips = read(() -> reader.trips(cutoff));
        CompletableFuture<List<InventoryStock>> stocks = read(() -> reader.stocks(cutoff));
        CompletableFuture<List<Group>> groups = read(reader::groups);

        try {
            CompletableFuture.allOf(ledgers, customers, vendors, vouchers, trips, stocks, groups).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }

        ReplaySnapshot snapshot = new ReplaySnapshot(asOf, cutoff,
            ledgers.join(), customers.join(), vendors.join(),
            vouchers.join(), trips.join(), stocks.join(), groups.join());

        log.debug("Replay snapshot loaded: asOf={}, ledgers={}, customers={}, vendors={}, vouchers={}, trips={}, "
                + "stocks={}, groups={}, duration={}ms",
            asOf, snapshot.getLedgers().size(), snapshot.getCustomers().size(), snapshot.getVendors().size(),
            snapshot.getVouchers().size(), snapshot.getTrips().size(), snapshot.getStocks().size(),
            snapshot.getGroups().size(), System.currentTimeMillis() - startTime);
        return snapshot;
    }

    private <T> CompletableFuture<T> read(Supplier<T> query) {
        return CompletableFuture.supplyAsync(query, executor);
    }
}
