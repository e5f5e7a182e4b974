package com.flagship.trade_ledger.voucher;

/**
 * Voucher types handled by the balance engine.
 *
 * PAYMENT and RECEIPT name parties and a cash/bank account;
 * JOURNAL and CONTRA carry free-form debit/credit entries.
 */
public enum VoucherType {
    PAYMENT,
    RECEIPT,
    JOURNAL,
    CONTRA;

    public boolean isPartyBased() {
        return this == PAYMENT || this == RECEIPT;
    }
}
