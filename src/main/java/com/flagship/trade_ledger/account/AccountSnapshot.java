package com.flagship.trade_ledger.account;

import com.flagship.trade_ledger.balance.SignedBalance;
import lombok.Value;

import java.util.UUID;

/**
 * Read-only view of an account taken for a report.
 * Detached from persistence, safe to share between threads.
 */
@Value
public class AccountSnapshot {
    UUID id;
    AccountKind kind;
    String name;
    UUID groupId;
    SignedBalance opening;
    SignedBalance outstanding;
}
