package com.flagship.trade_ledger.posting;

import com.flagship.trade_ledger.account.AccountKind;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.UUID;

/**
 * The account a voucher line points at, or the reason it points nowhere.
 *
 * Two resolutions of the same account are equal regardless of the name they
 * were found under, so deltas can be netted per account.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResolvedAccount {

    public enum Kind {
        LEDGER,
        CUSTOMER,
        VENDOR,
        UNRESOLVED
    }

    Kind kind;
    UUID id;
    @EqualsAndHashCode.Exclude
    String name;

    public static ResolvedAccount ledger(UUID id, String name) {
        return new ResolvedAccount(Kind.LEDGER, id, name);
    }

    public static ResolvedAccount customer(UUID id, String name) {
        return new ResolvedAccount(Kind.CUSTOMER, id, name);
    }

    public static ResolvedAccount vendor(UUID id, String name) {
        return new ResolvedAccount(Kind.VENDOR, id, name);
    }

    public static ResolvedAccount unresolved(String reference) {
        return new ResolvedAccount(Kind.UNRESOLVED, null, reference);
    }

    public boolean isResolved() {
        return kind != Kind.UNRESOLVED;
    }

    public AccountKind toAccountKind() {
        return switch (kind) {
            case LEDGER -> AccountKind.LEDGER;
            case CUSTOMER -> AccountKind.CUSTOMER;
            case VENDOR -> AccountKind.VENDOR;
            case UNRESOLVED -> throw new IllegalStateException("Unresolved account has no kind: " + name);
        };
    }
}
