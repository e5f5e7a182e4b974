package com.flagship.trade_ledger.balance;

/**
 * The two sides of a double-entry balance.
 * Assets net positive on DEBIT, liabilities net positive on CREDIT.
 */
public enum BalanceSide {
    DEBIT,
    CREDIT;

    public BalanceSide opposite() {
        return this == DEBIT ? CREDIT : DEBIT;
    }
}
