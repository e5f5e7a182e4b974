package com.flagship.trade_ledger.exception;

import java.util.UUID;

public class VoucherNotFoundException extends ResourceNotFoundException {

    public VoucherNotFoundException(UUID voucherId) {
        super("Voucher", voucherId);
    }
}
