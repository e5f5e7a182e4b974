package com.flagship.trade_ledger.account;

public enum LedgerType {
    VENDOR,
    CUSTOMER,
    OTHER
}
