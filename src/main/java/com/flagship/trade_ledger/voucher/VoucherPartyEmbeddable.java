package com.flagship.trade_ledger.voucher;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VoucherPartyEmbeddable {

    @Column(name = "party_id", nullable = false)
    private UUID partyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "party_type", nullable = false, length = 10)
    private PartyType partyType;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    static VoucherPartyEmbeddable fromDomain(VoucherParty party) {
        return new VoucherPartyEmbeddable(party.getPartyId(), party.getPartyType(), party.getAmount());
    }

    VoucherParty toDomain() {
        return new VoucherParty(partyId, partyType, amount);
    }
}
