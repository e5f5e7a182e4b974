package com.flagship.trade_ledger.voucher;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A posted financial transaction.
 *
 * Exactly one shape is populated: {@code parties} + {@code accountId} for
 * Payment/Receipt, {@code entries} for Journal/Contra. An inactive voucher is
 * soft-deleted and excluded from every aggregation.
 */
@Value
@Builder(toBuilder = true)
public class Voucher {
    UUID id;
    long voucherNumber;
    VoucherType voucherType;
    Instant date;
    List<VoucherParty> parties;
    UUID accountId;
    List<VoucherEntry> entries;
    BigDecimal totalDebit;
    BigDecimal totalCredit;
    String narration;
    boolean active;
    String createdBy;
    String updatedBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Sum of all party amounts; the cash/bank leg moves by this much.
     */
    public BigDecimal partyTotal() {
        return parties.stream()
            .map(VoucherParty::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean isOnOrBefore(Instant cutoff) {
        return date != null && !date.isAfter(cutoff);
    }
}
