package com.flagship.trade_ledger.posting;

import com.flagship.trade_ledger.voucher.PartyType;

import java.util.UUID;

/**
 * Maps voucher references onto concrete accounts.
 */
public interface AccountResolver {

    /**
     * Resolves a free-text Journal/Contra account name: ledger by slug or name
     * first, then customer by shop or owner name, then vendor by name.
     */
    ResolvedAccount resolveByName(String accountName);

    /**
     * Resolves a Payment/Receipt party. A vendor party resolves to the ledger
     * linked to that vendor.
     */
    ResolvedAccount resolveParty(PartyType partyType, UUID partyId);
}
