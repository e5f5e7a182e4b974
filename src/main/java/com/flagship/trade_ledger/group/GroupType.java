package com.flagship.trade_ledger.group;

/**
 * Top-level classification of a group in the chart of accounts.
 * ASSETS and LIABILITY appear on the balance sheet; INCOME and EXPENSES feed capital.
 */
public enum GroupType {
    ASSETS,
    LIABILITY,
    INCOME,
    EXPENSES
}
