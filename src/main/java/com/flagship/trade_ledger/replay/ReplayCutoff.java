package com.flagship.trade_ledger.replay;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Inclusive cutoff for an as-of date: the last millisecond of that day.
 */
public final class ReplayCutoff {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    private ReplayCutoff() {
    }

    public static Instant endOfDay(LocalDate asOf, ZoneId zone) {
        return asOf.atTime(END_OF_DAY).atZone(zone).toInstant();
    }
}
