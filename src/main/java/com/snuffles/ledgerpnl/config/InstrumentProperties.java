package com.snuffles.ledgerpnl.config;

import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Contract multipliers per canonical instrument code, plus aliases for stream
 * prefixes that are not canonical codes themselves.
 */
@Validated
@ConfigurationProperties(prefix = "pnl.instruments")
public record InstrumentProperties(
    @NotEmpty Map<String, BigDecimal> multipliers,
    Map<String, String> aliases
) {
    public InstrumentProperties {
        multipliers = multipliers == null ? Map.of() : Map.copyOf(multipliers);
        aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
    }
}
