package com.flagship.trade_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Balance sheet replayed from raw transactions as of a date.
 *
 * {@code totals.balance} is assets minus (liabilities + capital) and should
 * be zero for consistent books.
 */
@Value
@Builder
public class BalanceSheet {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("assets")
    Section assets;

    @JsonProperty("liabilities")
    Section liabilities;

    @JsonProperty("capital")
    Capital capital;

    @JsonProperty("totals")
    Totals totals;

    @JsonProperty("computation_errors")
    int computationErrors;

    @JsonProperty("detached_groups")
    List<UUID> detachedGroups;

    @Value
    public static class Section {

        @JsonProperty("groups")
        List<GroupBalance> groups;

        @JsonProperty("total")
        BigDecimal total;
    }

    @Value
    public static class Capital {

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("total")
        BigDecimal total;
    }

    @Value
    @Builder
    public static class Totals {

        @JsonProperty("total_assets")
        BigDecimal totalAssets;

        @JsonProperty("total_liabilities")
        BigDecimal totalLiabilities;

        @JsonProperty("total_capital")
        BigDecimal totalCapital;

        @JsonProperty("total_liabilities_and_capital")
        BigDecimal totalLiabilitiesAndCapital;

        @JsonProperty("balance")
        BigDecimal balance;
    }
}
