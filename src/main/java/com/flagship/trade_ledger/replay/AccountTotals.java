package com.flagship.trade_ledger.replay;

import com.flagship.trade_ledger.balance.BalanceSide;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Debit and credit totals replayed for one account.
 */
@Value
public class AccountTotals {

    public static final AccountTotals ZERO = new AccountTotals(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal debitTotal;
    BigDecimal creditTotal;

    /**
     * debit - credit
     */
    public BigDecimal balance() {
        return debitTotal.subtract(creditTotal);
    }

    public AccountTotals plus(BalanceSide side, BigDecimal amount) {
        return side == BalanceSide.DEBIT
            ? new AccountTotals(debitTotal.add(amount), creditTotal)
            : new AccountTotals(debitTotal, creditTotal.add(amount));
    }

    public AccountTotals plus(AccountTotals other) {
        return new AccountTotals(debitTotal.add(other.debitTotal), creditTotal.add(other.creditTotal));
    }
}
