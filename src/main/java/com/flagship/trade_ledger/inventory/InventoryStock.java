package com.flagship.trade_ledger.inventory;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class InventoryStock {
    UUID id;
    Instant date;
    StockType type;
    BigDecimal amount;
    UUID vendorId;

    public boolean isOnOrBefore(Instant cutoff) {
        return date != null && !date.isAfter(cutoff);
    }
}
