package com.flagship.trade_ledger.replay;

import com.flagship.trade_ledger.balance.BalanceSide;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Debit/credit totals accumulated from vouchers, in two independent parts:
 *
 * - per account name, from Journal/Contra entries; names are compared
 *   trimmed and case-insensitively
 * - per ledger id, from the ledger legs of Payment/Receipt vouchers (the
 *   cash/bank account and any ledger-type party)
 *
 * Customer and vendor parties never appear here; their replay reads the
 * vouchers directly.
 */
public final class VoucherBalanceMap {

    private final Map<String, AccountTotals> byName;
    private final Map<UUID, AccountTotals> byLedgerId;

    private VoucherBalanceMap(Map<String, AccountTotals> byName, Map<UUID, AccountTotals> byLedgerId) {
        this.byName = Collections.unmodifiableMap(byName);
        this.byLedgerId = Collections.unmodifiableMap(byLedgerId);
    }

    public static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public AccountTotals totalsFor(String name) {
        return byName.getOrDefault(normalize(name), AccountTotals.ZERO);
    }

    public AccountTotals ledgerLegsFor(UUID ledgerId) {
        return ledgerId == null ? AccountTotals.ZERO : byLedgerId.getOrDefault(ledgerId, AccountTotals.ZERO);
    }

    public boolean contains(String name) {
        return byName.containsKey(normalize(name));
    }

    public Set<String> names() {
        return byName.keySet();
    }

    /**
     * Number of names with entry totals.
     */
    public int size() {
        return byName.size();
    }

    public int ledgerLegCount() {
        return byLedgerId.size();
    }

    public static final class Builder {

        private final Map<String, AccountTotals> byName = new LinkedHashMap<>();
        private final Map<UUID, AccountTotals> byLedgerId = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String name, BalanceSide side, BigDecimal amount) {
            String key = normalize(name);
            if (key.isEmpty() || amount == null || amount.signum() == 0) {
                return this;
            }
            byName.merge(key, AccountTotals.ZERO.plus(side, amount), AccountTotals::plus);
            return this;
        }

        public Builder addLedgerLeg(UUID ledgerId, BalanceSide side, BigDecimal amount) {
            if (ledgerId == null || amount == null || amount.signum() == 0) {
                return this;
            }
            byLedgerId.merge(ledgerId, AccountTotals.ZERO.plus(side, amount), AccountTotals::plus);
            return this;
        }

        public VoucherBalanceMap build() {
            return new VoucherBalanceMap(new LinkedHashMap<>(byName), new LinkedHashMap<>(byLedgerId));
        }
    }
}
