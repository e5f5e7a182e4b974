package com.flagship.trade_ledger.trip;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A trip's sales and purchases. Trips post straight to customer and vendor
 * balances without a voucher, dated by {@code createdAt}.
 */
@Value
public class Trip {
    UUID id;
    Instant createdAt;
    List<TripSale> sales;
    List<TripPurchase> purchases;

    public boolean isOnOrBefore(Instant cutoff) {
        return createdAt != null && !createdAt.isAfter(cutoff);
    }
}
