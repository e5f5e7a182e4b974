package com.flagship.trade_ledger.balance;

/**
 * Raised when balance arithmetic receives input it cannot work with
 * (missing or negative amounts).
 *
 * Callers on the posting and replay paths treat it as a zero-effect no-op
 * and count it, so reports keep computing.
 */
public class BalanceComputationException extends RuntimeException {

    public BalanceComputationException(String message) {
        super(message);
    }
}
