package com.flagship.trade_ledger.voucher;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VoucherEntryEmbeddable {

    @Column(nullable = false, length = 100)
    private String account;

    @Column(name = "debit_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal debitAmount;

    @Column(name = "credit_amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal creditAmount;

    @Column(length = 500)
    private String narration;

    static VoucherEntryEmbeddable fromDomain(VoucherEntry entry) {
        return new VoucherEntryEmbeddable(entry.getAccount().trim(), entry.debitOrZero(),
            entry.creditOrZero(), entry.getNarration());
    }

    VoucherEntry toDomain() {
        return new VoucherEntry(account, debitAmount, creditAmount, narration);
    }
}
