package com.snuffles.ledgerpnl.domain;

import java.math.BigDecimal;

/**
 * Lifecycle of a trading intent, derived from its fill quantities and exit price.
 */
public enum IntentStatus {
    OPEN, PARTIAL, CLOSED;

    /**
     * OPEN while nothing has exited or no exit price is known, CLOSED once the
     * exited quantity reaches the entered quantity, PARTIAL in between.
     */
    public static IntentStatus of(int exitQty, int entryQty, BigDecimal avgExitPrice) {
        if (exitQty == 0 || avgExitPrice == null) {
            return OPEN;
        }
        if (exitQty >= entryQty) {
            return CLOSED;
        }
        return PARTIAL;
    }

    public boolean isRealized() {
        return this == PARTIAL || this == CLOSED;
    }
}
