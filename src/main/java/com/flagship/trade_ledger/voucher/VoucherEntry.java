package com.flagship.trade_ledger.voucher;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of a Journal or Contra voucher. {@code account} is a free-text
 * account name resolved against ledgers, customers and vendors.
 */
@Value
public class VoucherEntry {
    String account;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    String narration;

    public BigDecimal debitOrZero() {
        return debitAmount == null ? BigDecimal.ZERO : debitAmount;
    }

    public BigDecimal creditOrZero() {
        return creditAmount == null ? BigDecimal.ZERO : creditAmount;
    }
}
