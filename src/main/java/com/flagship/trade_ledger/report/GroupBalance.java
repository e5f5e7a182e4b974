package com.flagship.trade_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_ledger.group.GroupType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * One group of the balance sheet with its descendants already rolled in.
 */
@Value
@Builder
public class GroupBalance {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("type")
    GroupType type;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("debit_total")
    BigDecimal debitTotal;

    @JsonProperty("credit_total")
    BigDecimal creditTotal;

    @JsonProperty("opening_balance")
    BigDecimal openingBalance;

    @JsonProperty("outstanding_balance")
    BigDecimal outstandingBalance;

    @JsonProperty("children")
    List<GroupBalance> children;
}
