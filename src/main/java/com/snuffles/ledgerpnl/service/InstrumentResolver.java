package com.snuffles.ledgerpnl.service;

import com.snuffles.ledgerpnl.domain.InstrumentResolution;
import com.snuffles.ledgerpnl.domain.LedgerRow;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a ledger row to the dollar value of one point for one contract.
 * <p>
 * The explicit instrument wins when it is a known code; otherwise the code is
 * derived from the leading letters of the stream id ("NQ1" -> "NQ"). Anything
 * that cannot be mapped falls back to a multiplier of 1 with a warning.
 */
@Slf4j
public class InstrumentResolver {

    private final Map<String, BigDecimal> multipliers;
    private final Map<String, String> aliases;

    public InstrumentResolver(Map<String, BigDecimal> multipliers, Map<String, String> aliases) {
        this.multipliers = Map.copyOf(multipliers);
        this.aliases = Map.copyOf(aliases);
        aliases.forEach((alias, target) -> {
            if (!this.multipliers.containsKey(target)) {
                throw new IllegalStateException("Alias " + alias + " points at unknown instrument " + target);
            }
        });
    }

    public InstrumentResolution resolve(LedgerRow row) {
        String instrument = row.getInstrument();
        if (instrument != null && !instrument.isBlank()) {
            BigDecimal multiplier = multipliers.get(instrument.toUpperCase(Locale.ROOT));
            if (multiplier != null) {
                return new InstrumentResolution(multiplier, instrument.toUpperCase(Locale.ROOT), null);
            }
            log.debug("Instrument {} on intent {} is not canonical; deriving from stream {}",
                instrument, row.getIntentId(), row.getStream());
        }

        String derived = deriveInstrument(row.getStream());
        if (derived == null && instrument != null && !instrument.isBlank()) {
            log.warn("Unknown instrument {} (stream {}), using multiplier 1", instrument, row.getStream());
            return new InstrumentResolution(BigDecimal.ONE, instrument, InstrumentResolution.Warning.UNKNOWN_INSTRUMENT);
        }
        if (derived == null) {
            log.warn("Cannot determine instrument for stream {}, using multiplier 1", row.getStream());
            return new InstrumentResolution(BigDecimal.ONE, null, InstrumentResolution.Warning.UNRESOLVABLE_STREAM);
        }

        BigDecimal multiplier = multipliers.get(derived);
        if (multiplier == null) {
            log.warn("Unknown instrument {} (stream {}), using multiplier 1", derived, row.getStream());
            return new InstrumentResolution(BigDecimal.ONE, derived, InstrumentResolution.Warning.UNKNOWN_INSTRUMENT);
        }
        return new InstrumentResolution(multiplier, derived, null);
    }

    /**
     * Leading non-digit run of the stream id, upper-cased and passed through
     * the alias table. Returns null for a blank stream or one that starts with
     * a digit.
     */
    public String deriveInstrument(String stream) {
        if (stream == null || stream.isBlank()) {
            return null;
        }
        int end = 0;
        while (end < stream.length() && !Character.isDigit(stream.charAt(end))) {
            end++;
        }
        String prefix = stream.substring(0, end).trim().toUpperCase(Locale.ROOT);
        if (prefix.isEmpty()) {
            return null;
        }
        if (multipliers.containsKey(prefix)) {
            return prefix;
        }
        return aliases.getOrDefault(prefix, prefix);
    }

    /**
     * Read-only view of the configured table, for inspection.
     */
    public Map<String, BigDecimal> getMultipliers() {
        return multipliers;
    }
}
