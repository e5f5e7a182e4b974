package com.flagship.trade_ledger.voucher.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trade_ledger.voucher.PartyType;
import com.flagship.trade_ledger.voucher.VoucherDraft;
import com.flagship.trade_ledger.voucher.VoucherEntry;
import com.flagship.trade_ledger.voucher.VoucherParty;
import com.flagship.trade_ledger.voucher.VoucherType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Request body for posting or editing a voucher. Type-specific shape rules
 * are checked by the voucher validator, not here.
 */
@Value
public class VoucherRequest {

    @NotNull(message = "Voucher type is required")
    @JsonProperty("voucher_type")
    VoucherType voucherType;

    @JsonProperty("date")
    Instant date;

    @Valid
    @JsonProperty("parties")
    List<PartyRequest> parties;

    @JsonProperty("account_id")
    UUID accountId;

    @Valid
    @JsonProperty("entries")
    List<EntryRequest> entries;

    @Size(max = 500, message = "Narration must be at most 500 characters")
    @JsonProperty("narration")
    String narration;

    public VoucherDraft toDraft() {
        return VoucherDraft.builder()
            .voucherType(voucherType)
            .date(date)
            .parties(parties == null ? List.of() : parties.stream().map(PartyRequest::toDomain).toList())
            .accountId(accountId)
            .entries(entries == null ? List.of() : entries.stream().map(EntryRequest::toDomain).toList())
            .narration(narration)
            .build();
    }

    @Value
    public static class PartyRequest {

        @JsonProperty("party_id")
        UUID partyId;

        @JsonProperty("party_type")
        PartyType partyType;

        @JsonProperty("amount")
        BigDecimal amount;

        VoucherParty toDomain() {
            return new VoucherParty(partyId, partyType, amount);
        }
    }

    @Value
    public static class EntryRequest {

        @JsonProperty("account")
        String account;

        @JsonProperty("debit_amount")
        BigDecimal debitAmount;

        @JsonProperty("credit_amount")
        BigDecimal creditAmount;

        @JsonProperty("narration")
        String narration;

        VoucherEntry toDomain() {
            return new VoucherEntry(account, debitAmount, creditAmount, narration);
        }
    }
}
