package com.flagship.trade_ledger.voucher;

public enum PartyType {
    CUSTOMER,
    VENDOR,
    LEDGER
}
