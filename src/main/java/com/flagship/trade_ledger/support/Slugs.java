package com.flagship.trade_ledger.support;

import java.util.Locale;

/**
 * URL-safe identifiers derived from display names ("Cash-in-Hand" -> "cash-in-hand").
 */
public final class Slugs {

    private Slugs() {
        // Utility class
    }

    public static String slugify(String name) {
        if (name == null) {
            return null;
        }
        return name.toLowerCase(Locale.ROOT)
            .trim()
            .replaceAll("[\\s\\W-]+", "-")
            .replaceAll("^-+|-+$", "");
    }
}
