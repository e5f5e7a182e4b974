package com.flagship.trade_ledger.sequence;

/**
 * Named, monotonically increasing counters.
 */
public interface SequenceAllocator {

    String VOUCHER_NUMBER = "voucherNumber";

    /**
     * Atomically increments and returns the counter, creating it at 1.
     * Concurrent callers always receive distinct values.
     */
    long next(String name);

    /**
     * The value {@link #next} would return if called now. Advisory only:
     * another caller may take that value first.
     */
    long peek(String name);
}
