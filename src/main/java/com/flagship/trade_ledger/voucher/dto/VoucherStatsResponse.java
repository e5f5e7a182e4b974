package com.flagship.trade_ledger.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_ledger.voucher.VoucherStats;
import com.flagship.trade_ledger.voucher.VoucherType;
import lombok.Value;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Value
public class VoucherStatsResponse {

    @JsonProperty("by_type")
    Map<String, TypeStats> byType;

    @JsonProperty("count")
    long count;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("balance")
    BigDecimal balance;

    public static VoucherStatsResponse from(VoucherStats stats) {
        Map<String, TypeStats> byType = new LinkedHashMap<>();
        for (Map.Entry<VoucherType, VoucherStats.TypeTotals> entry : stats.getByType().entrySet()) {
            VoucherStats.TypeTotals totals = entry.getValue();
            byType.put(entry.getKey().name().toLowerCase(Locale.ROOT),
                new TypeStats(totals.getCount(), totals.getTotalDebit(), totals.getTotalCredit()));
        }
        return new VoucherStatsResponse(byType, stats.getCount(), stats.getTotalDebit(),
            stats.getTotalCredit(), stats.balance());
    }

    @Value
    public static class TypeStats {
        @JsonProperty("count")
        long count;

        @JsonProperty("total_debit")
        BigDecimal totalDebit;

        @JsonProperty("total_credit")
        BigDecimal totalCredit;
    }
}
