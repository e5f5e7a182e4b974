package com.flagship.trade_ledger.replay;

import com.flagship.trade_ledger.account.AccountSnapshot;
import com.flagship.trade_ledger.balance.BalanceSide;
import com.flagship.trade_ledger.group.GroupType;
import com.flagship.trade_ledger.inventory.InventoryStock;
import com.flagship.trade_ledger.trip.Trip;
import com.flagship.trade_ledger.trip.TripPurchase;
import com.flagship.trade_ledger.trip.TripSale;
import com.flagship.trade_ledger.voucher.PartyType;
import com.flagship.trade_ledger.voucher.Voucher;
import com.flagship.trade_ledger.voucher.VoucherEntry;
import com.flagship.trade_ledger.voucher.VoucherParty;
import com.flagship.trade_ledger.voucher.VoucherType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Recomputes balances from raw transactions, independently of the stored
 * outstanding balances.
 *
 * Every method is a pure function of its arguments. Only active vouchers,
 * trips and stock movements dated on or before the cutoff count.
 * Signed values follow {@link com.flagship.trade_ledger.balance.SignedBalance#toSigned()}:
 * positive is a debit balance, negative a credit balance.
 */
@Component
public class TransactionReplayAggregator {

    /**
     * Journal/Contra entries summed per account name, as written.
     *
     * Payment/Receipt vouchers add only their ledger legs, keyed by ledger id:
     * the cash/bank account on the opposite side of the party total, and each
     * ledger-type party on the party side (Payment debit, Receipt credit).
     * Customer and vendor parties are left to {@link #customerBalance} and
     * {@link #vendorBalance}.
     */
    public VoucherBalanceMap buildVoucherBalanceMap(Collection<Voucher> vouchers, Instant cutoff) {
        VoucherBalanceMap.Builder map = VoucherBalanceMap.builder();
        for (Voucher voucher : vouchers) {
            if (!counts(voucher, cutoff)) {
                continue;
            }
            if (voucher.getVoucherType().isPartyBased()) {
                BalanceSide partySide = partySide(voucher.getVoucherType());
                for (VoucherParty party : voucher.getParties()) {
                    if (party.getPartyType() == PartyType.LEDGER) {
                        map.addLedgerLeg(party.getPartyId(), partySide, party.getAmount());
                    }
                }
                map.addLedgerLeg(voucher.getAccountId(), partySide.opposite(), voucher.partyTotal());
            } else {
                for (VoucherEntry entry : voucher.getEntries()) {
                    map.add(entry.getAccount(), BalanceSide.DEBIT, entry.debitOrZero());
                    map.add(entry.getAccount(), BalanceSide.CREDIT, entry.creditOrZero());
                }
            }
        }
        return map.build();
    }

    /**
     * Entry totals recorded under a ledger name.
     */
    public AccountTotals ledgerBalance(String ledgerName, VoucherBalanceMap map) {
        return map.totalsFor(ledgerName);
    }

    /**
     * Full voucher movement of one ledger: entries under its name plus its
     * Payment/Receipt legs.
     */
    public AccountTotals ledgerBalance(AccountSnapshot ledger, VoucherBalanceMap map) {
        return ledgerBalance(ledger.getName(), map).plus(map.ledgerLegsFor(ledger.getId()));
    }

    /**
     * Opening + Payment parties - Receipt parties + unsettled trip sales.
     */
    public BigDecimal customerBalance(AccountSnapshot customer, Collection<Voucher> vouchers,
                                      Collection<Trip> trips, Instant cutoff) {
        BigDecimal balance = customer.getOpening().toSigned()
            .add(partyMovement(customer.getId(), PartyType.CUSTOMER, vouchers, cutoff));

        for (Trip trip : trips) {
            if (!trip.isOnOrBefore(cutoff)) {
                continue;
            }
            for (TripSale sale : trip.getSales()) {
                if (customer.getId().equals(sale.getClientId()) && !sale.isReceipt()) {
                    balance = balance.add(orZero(sale.getAmount())).subtract(sale.settledAmount());
                }
            }
        }
        return balance;
    }

    /**
     * Opening + Payment parties - Receipt parties - trip purchases - stock bought from the vendor.
     */
    public BigDecimal vendorBalance(AccountSnapshot vendor, Collection<Voucher> vouchers,
                                    Collection<Trip> trips, Collection<InventoryStock> stocks, Instant cutoff) {
        BigDecimal balance = vendor.getOpening().toSigned()
            .add(partyMovement(vendor.getId(), PartyType.VENDOR, vouchers, cutoff));

        for (Trip trip : trips) {
            if (!trip.isOnOrBefore(cutoff)) {
                continue;
            }
            for (TripPurchase purchase : trip.getPurchases()) {
                if (vendor.getId().equals(purchase.getSupplierId())) {
                    balance = balance.subtract(orZero(purchase.getAmount()));
                }
            }
        }
        for (InventoryStock stock : stocks) {
            if (stock.isOnOrBefore(cutoff)
                && vendor.getId().equals(stock.getVendorId())
                && stock.getType() != null
                && stock.getType().isPayableToVendor()) {
                balance = balance.subtract(orZero(stock.getAmount()));
            }
        }
        return balance;
    }

    /**
     * Net income: income ledgers' (credit - debit) less expense ledgers' (debit - credit).
     * Ledgers outside Income/Expenses groups do not count.
     */
    public BigDecimal capital(VoucherBalanceMap map, Collection<AccountSnapshot> ledgers,
                              Map<UUID, GroupType> groupTypes) {
        BigDecimal income = BigDecimal.ZERO;
        BigDecimal expenses = BigDecimal.ZERO;
        for (AccountSnapshot ledger : ledgers) {
            GroupType type = Optional.ofNullable(ledger.getGroupId()).map(groupTypes::get).orElse(null);
            if (type == null) {
                continue;
            }
            AccountTotals totals = ledgerBalance(ledger, map);
            if (type == GroupType.INCOME) {
                income = income.add(totals.getCreditTotal().subtract(totals.getDebitTotal()));
            } else if (type == GroupType.EXPENSES) {
                expenses = expenses.add(totals.getDebitTotal().subtract(totals.getCreditTotal()));
            }
        }
        return income.subtract(expenses);
    }

    private BigDecimal partyMovement(UUID partyId, PartyType partyType, Collection<Voucher> vouchers, Instant cutoff) {
        BigDecimal movement = BigDecimal.ZERO;
        for (Voucher voucher : vouchers) {
            if (!counts(voucher, cutoff) || !voucher.getVoucherType().isPartyBased()) {
                continue;
            }
            for (VoucherParty party : voucher.getParties()) {
                if (party.getPartyType() == partyType && partyId.equals(party.getPartyId())) {
                    BigDecimal amount = orZero(party.getAmount());
                    movement = voucher.getVoucherType() == VoucherType.PAYMENT
                        ? movement.add(amount)
                        : movement.subtract(amount);
                }
            }
        }
        return movement;
    }

    private static boolean counts(Voucher voucher, Instant cutoff) {
        return voucher.isActive() && voucher.isOnOrBefore(cutoff);
    }

    private static BalanceSide partySide(VoucherType type) {
        return type == VoucherType.PAYMENT ? BalanceSide.DEBIT : BalanceSide.CREDIT;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
