package com.flagship.trade_ledger.exception;

import com.flagship.trade_ledger.account.AccountKind;

import java.util.UUID;

public class AccountNotFoundException extends ResourceNotFoundException {

    public AccountNotFoundException(AccountKind kind, UUID id) {
        super(describe(kind), id);
    }

    private static String describe(AccountKind kind) {
        return switch (kind) {
            case LEDGER -> "Ledger";
            case CUSTOMER -> "Customer";
            case VENDOR -> "Vendor";
        };
    }
}
