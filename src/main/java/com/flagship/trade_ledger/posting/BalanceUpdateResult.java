package com.flagship.trade_ledger.posting;

import com.flagship.trade_ledger.balance.SignedBalance;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * What happened to one account during a voucher's balance update.
 * {@code before}/{@code after} are only set for APPLIED.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BalanceUpdateResult {

    public enum Outcome {
        APPLIED,
        SKIPPED,
        FAILED
    }

    ResolvedAccount.Kind kind;
    UUID accountId;
    String accountName;
    Outcome outcome;
    SignedBalance before;
    SignedBalance after;
    String reason;

    public static BalanceUpdateResult applied(ResolvedAccount account, SignedBalance before, SignedBalance after) {
        return new BalanceUpdateResult(account.getKind(), account.getId(), account.getName(),
            Outcome.APPLIED, before, after, null);
    }

    public static BalanceUpdateResult skipped(ResolvedAccount account, String reason) {
        return new BalanceUpdateResult(account.getKind(), account.getId(), account.getName(),
            Outcome.SKIPPED, null, null, reason);
    }

    public static BalanceUpdateResult failed(ResolvedAccount account, String reason) {
        return new BalanceUpdateResult(account.getKind(), account.getId(), account.getName(),
            Outcome.FAILED, null, null, reason);
    }
}
