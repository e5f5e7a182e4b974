package com.flagship.trade_ledger.voucher;

import com.flagship.trade_ledger.posting.BalanceUpdateReport;
import lombok.Value;

/**
 * A stored voucher together with what happened to account balances.
 * {@code reversed} is the backing out of an earlier version (edit or
 * deactivation); {@code applied} is the new effect.
 */
@Value
public class PostedVoucher {
    Voucher voucher;
    BalanceUpdateReport reversed;
    BalanceUpdateReport applied;
}
