package com.flagship.trade_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_ledger.account.AccountKind;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * An account whose live outstanding balance disagrees with its replay.
 * Both balances are signed (debit positive).
 */
@Value
public class AccountDrift {

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("kind")
    AccountKind kind;

    @JsonProperty("name")
    String name;

    @JsonProperty("outstanding")
    BigDecimal outstanding;

    @JsonProperty("replayed")
    BigDecimal replayed;

    @JsonProperty("difference")
    BigDecimal difference;
}
