package com.flagship.trade_ledger.account;

/**
 * The concrete variants of a balance-carrying account.
 */
public enum AccountKind {
    LEDGER,
    CUSTOMER,
    VENDOR
}
