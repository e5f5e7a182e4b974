package com.flagship.trade_ledger.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_ledger.voucher.PartyType;
import com.flagship.trade_ledger.voucher.Voucher;
import com.flagship.trade_ledger.voucher.VoucherType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class VoucherResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("voucher_number")
    long voucherNumber;

    @JsonProperty("voucher_type")
    VoucherType voucherType;

    @JsonProperty("date")
    Instant date;

    @JsonProperty("parties")
    List<Party> parties;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("entries")
    List<Entry> entries;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("narration")
    String narration;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("updated_by")
    String updatedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static VoucherResponse from(Voucher voucher) {
        return VoucherResponse.builder()
            .id(voucher.getId())
            .voucherNumber(voucher.getVoucherNumber())
            .voucherType(voucher.getVoucherType())
            .date(voucher.getDate())
            .parties(voucher.getParties().stream()
                .map(p -> new Party(p.getPartyId(), p.getPartyType(), p.getAmount()))
                .toList())
            .accountId(voucher.getAccountId())
            .entries(voucher.getEntries().stream()
                .map(e -> new Entry(e.getAccount(), e.getDebitAmount(), e.getCreditAmount(), e.getNarration()))
                .toList())
            .totalDebit(voucher.getTotalDebit())
            .totalCredit(voucher.getTotalCredit())
            .narration(voucher.getNarration())
            .active(voucher.isActive())
            .createdBy(voucher.getCreatedBy())
            .updatedBy(voucher.getUpdatedBy())
            .createdAt(voucher.getCreatedAt())
            .updatedAt(voucher.getUpdatedAt())
            .build();
    }

    @Value
    public static class Party {
        @JsonProperty("party_id")
        UUID partyId;

        @JsonProperty("party_type")
        PartyType partyType;

        @JsonProperty("amount")
        BigDecimal amount;
    }

    @Value
    public static class Entry {
        @JsonProperty("account")
        String account;

        @JsonProperty("debit_amount")
        BigDecimal debitAmount;

        @JsonProperty("credit_amount")
        BigDecimal creditAmount;

        @JsonProperty("narration")
        String narration;
    }
}
