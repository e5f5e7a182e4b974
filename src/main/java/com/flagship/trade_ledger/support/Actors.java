package com.flagship.trade_ledger.support;

/**
 * Who performed a change. Authentication happens upstream; the acting user
 * arrives in a request header.
 */
public final class Actors {

    public static final String HEADER = "X-User-Id";
    public static final String SYSTEM = "system";

    private Actors() {
    }
}
