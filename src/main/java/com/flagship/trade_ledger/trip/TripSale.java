package com.flagship.trade_ledger.trip;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A sale made on a trip. Non-receipt sales debit the client for {@code amount}
 * and credit it for what was settled on the spot.
 */
@Value
public class TripSale {
    UUID clientId;
    BigDecimal amount;
    BigDecimal cashPaid;
    BigDecimal onlinePaid;
    BigDecimal discount;
    boolean receipt;

    public BigDecimal settledAmount() {
        return orZero(cashPaid).add(orZero(onlinePaid)).add(orZero(discount));
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
