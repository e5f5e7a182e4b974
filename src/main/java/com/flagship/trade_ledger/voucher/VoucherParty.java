package com.flagship.trade_ledger.voucher;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One counterparty line of a Payment or Receipt voucher.
 */
@Value
public class VoucherParty {
    UUID partyId;
    PartyType partyType;
    BigDecimal amount;
}
