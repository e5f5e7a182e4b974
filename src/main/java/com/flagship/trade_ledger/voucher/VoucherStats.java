package com.flagship.trade_ledger.voucher;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Voucher counts and totals per type over a date range.
 */
@Value
public class VoucherStats {
    Map<VoucherType, TypeTotals> byType;
    long count;
    BigDecimal totalDebit;
    BigDecimal totalCredit;

    /**
     * Should be zero: every voucher type posts equal debits and credits.
     */
    public BigDecimal balance() {
        return totalDebit.subtract(totalCredit);
    }

    @Value
    public static class TypeTotals {
        public static final TypeTotals EMPTY = new TypeTotals(0, BigDecimal.ZERO, BigDecimal.ZERO);

        long count;
        BigDecimal totalDebit;
        BigDecimal totalCredit;

        TypeTotals plus(Voucher voucher) {
            return new TypeTotals(count + 1,
                totalDebit.add(voucher.getTotalDebit()),
                totalCredit.add(voucher.getTotalCredit()));
        }
    }
}
