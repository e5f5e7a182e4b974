package com.flagship.trade_ledger.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
public class ReconciliationReport {

    @JsonProperty("as_of")
    LocalDate asOf;

    @JsonProperty("accounts_checked")
    int accountsChecked;

    @JsonProperty("drifted")
    List<AccountDrift> drifted;

    @JsonProperty("computation_errors")
    int computationErrors;

    public boolean isClean() {
        return drifted.isEmpty();
    }
}
