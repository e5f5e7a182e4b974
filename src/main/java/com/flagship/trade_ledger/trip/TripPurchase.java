package com.flagship.trade_ledger.trip;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class TripPurchase {
    UUID supplierId;
    BigDecimal amount;
}
