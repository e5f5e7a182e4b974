package com.flagship.trade_ledger.replay;

import com.flagship.trade_ledger.account.AccountSnapshot;
import com.flagship.trade_ledger.group.Group;
import com.flagship.trade_ledger.group.GroupType;
import com.flagship.trade_ledger.inventory.InventoryStock;
import com.flagship.trade_ledger.trip.Trip;
import com.flagship.trade_ledger.voucher.Voucher;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything one balance sheet is replayed from, read once and never mutated.
 */
@Value
public class ReplaySnapshot {
    LocalDate asOf;
    Instant cutoff;
    List<AccountSnapshot> ledgers;
    List<AccountSnapshot> customers;
    List<AccountSnapshot> vendors;
    List<Voucher> vouchers;
    List<Trip> trips;
    List<InventoryStock> stocks;
    List<Group> groups;

    public Map<UUID, GroupType> groupTypes() {
        Map<UUID, GroupType> types = new HashMap<>();
        groups.forEach(g -> types.put(g.getId(), g.getType()));
        return types;
    }

    public List<Group> groupsOfType(GroupType type) {
        return groups.stream().filter(g -> g.getType() == type).toList();
    }
}
