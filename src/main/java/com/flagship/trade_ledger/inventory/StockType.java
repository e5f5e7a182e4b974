package com.flagship.trade_ledger.inventory;

public enum StockType {
    OPENING,
    PURCHASE,
    SALE,
    MORTALITY,
    WEIGHT_LOSS,
    CONSUME,
    RECEIPT,
    NATURAL_WEIGHT_LOSS;

    /**
     * Stock that was bought from a vendor and is owed to them.
     */
    public boolean isPayableToVendor() {
        return this == PURCHASE || this == OPENING;
    }
}
