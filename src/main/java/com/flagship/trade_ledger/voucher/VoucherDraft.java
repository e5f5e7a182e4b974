package com.flagship.trade_ledger.voucher;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The caller-supplied part of a voucher, before a number is allocated.
 * Used for both posting and editing.
 */
@Value
@Builder
public class VoucherDraft {
    VoucherType voucherType;
    Instant date;
    @Builder.Default
    List<VoucherParty> parties = List.of();
    UUID accountId;
    @Builder.Default
    List<VoucherEntry> entries = List.of();
    String narration;

    /**
     * Party-based vouchers post the party total to both sides.
     */
    public BigDecimal totalDebit() {
        if (voucherType != null && voucherType.isPartyBased()) {
            return partyTotal();
        }
        return entries.stream().map(VoucherEntry::debitOrZero).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalCredit() {
        if (voucherType != null && voucherType.isPartyBased()) {
            return partyTotal();
        }
        return entries.stream().map(VoucherEntry::creditOrZero).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private BigDecimal partyTotal() {
        return parties.stream()
            .map(VoucherParty::getAmount)
            .filter(amount -> amount != null)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
