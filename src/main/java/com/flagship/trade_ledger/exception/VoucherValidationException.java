package com.flagship.trade_ledger.exception;

import java.util.Map;

/**
 * A voucher has the wrong shape for its type. Raised before any state is touched.
 */
public class VoucherValidationException extends RuntimeException {

    private final Map<String, String> details;

    public VoucherValidationException(String message) {
        this(message, Map.of());
    }

    public VoucherValidationException(String message, Map<String, String> details) {
        super(message);
        this.details = Map.copyOf(details);
    }

    public Map<String, String> getDetails() {
        return details;
    }
}
