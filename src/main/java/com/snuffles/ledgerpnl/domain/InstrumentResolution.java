package com.snuffles.ledgerpnl.domain;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Contract multiplier chosen for a ledger row. {@code instrument} is the code
 * the lookup was attempted with (null when none could be derived) and
 * {@code warning} is set whenever the multiplier fell back to 1.
 */
@Value
public class InstrumentResolution {

    BigDecimal multiplier;
    String instrument;
    Warning warning;

    public enum Warning {
        UNKNOWN_INSTRUMENT, UNRESOLVABLE_STREAM
    }
}
