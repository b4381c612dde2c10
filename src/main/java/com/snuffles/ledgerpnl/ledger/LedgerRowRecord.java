package com.snuffles.ledgerpnl.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerRowRecord(
    @JsonProperty("intent_id") String intentId,
    @JsonProperty("trading_date") String tradingDate,
    String stream,
    String instrument,
    String direction,
    @JsonProperty("entry_price") BigDecimal entryPrice,
    @JsonProperty("entry_qty") Integer entryQty,
    @JsonProperty("exit_qty") Integer exitQty,
    @JsonProperty("avg_exit_price") BigDecimal avgExitPrice,
    @JsonProperty("total_costs") BigDecimal totalCosts,
    String status,
    @JsonProperty("pnl_confidence") String pnlConfidence
) {
}
