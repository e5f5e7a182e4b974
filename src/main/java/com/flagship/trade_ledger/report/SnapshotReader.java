package com.flagship.trade_ledger.report;

import com.flagship.trade_ledger.account.AccountSnapshot;
import com.flagship.trade_ledger.account.BalanceAccountEntity;
import com.flagship.trade_ledger.account.CustomerRepository;
import com.flagship.trade_ledger.account.LedgerRepository;
import com.flagship.trade_ledger.account.VendorRepository;
import com.flagship.trade_ledger.group.Group;
import com.flagship.trade_ledger.group.GroupEntity;
import com.flagship.trade_ledger.group.GroupRepository;
import com.flagship.trade_ledger.inventory.InventoryStock;
import com.flagship.trade_ledger.inventory.InventoryStockEntity;
import com.flagship.trade_ledger.inventory.InventoryStockRepository;
import com.flagship.trade_ledger.trip.Trip;
import com.flagship.trade_ledger.trip.TripEntity;
import com.flagship.trade_ledger.trip.TripRepository;
import com.flagship.trade_ledger.voucher.Voucher;
import com.flagship.trade_ledger.voucher.VoucherEntity;
import com.flagship.trade_ledger.voucher.VoucherRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Read-only queries behind a balance sheet. Each method runs in its own
 * read-only transaction and returns detached, immutable values, so the
 * calls can be issued from different threads.
 */
@Component
@RequiredArgsConstructor
public class SnapshotReader {

    private final LedgerRepository ledgerRepository;
    private final CustomerRepository customerRepository;
    private final VendorRepository vendorRepository;
    private final VoucherRepository voucherRepository;
    private final TripRepository tripRepository;
    private final InventoryStockRepository stockRepository;
    private final GroupRepository groupRepository;

    @Transactional(readOnly = true)
    public List<AccountSnapshot> ledgers() {
        return ledgerRepository.findAllByActiveTrue().stream().map(BalanceAccountEntity::toSnapshot).toList();
    }

    @Transactional(readOnly = true)
    public List<AccountSnapshot> customers() {
        return customerRepository.findAllByActiveTrue().stream().map(BalanceAccountEntity::toSnapshot).toList();
    }

    @Transactional(readOnly = true)
    public List<AccountSnapshot> vendors() {
        return vendorRepository.findAllByActiveTrue().stream().map(BalanceAccountEntity::toSnapshot).toList();
    }

    @Transactional(readOnly = true)
    public List<Voucher> vouchers(Instant cutoff) {
        return voucherRepository.findAllByActiveTrueAndDateLessThanEqualOrderByDateAsc(cutoff).stream()
            .map(VoucherEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Trip> trips(Instant cutoff) {
        return tripRepository.findAllByCreatedAtLessThanEqual(cutoff).stream().map(TripEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public List<InventoryStock> stocks(Instant cutoff) {
        return stockRepository.findAllByDateLessThanEqual(cutoff).stream()
            .map(InventoryStockEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Group> groups() {
        return groupRepository.findAllByActiveTrue().stream().map(GroupEntity::toDomain).toList();
    }
}
