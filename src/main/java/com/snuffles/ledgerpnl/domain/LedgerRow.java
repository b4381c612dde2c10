package com.snuffles.ledgerpnl.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * One trading intent as supplied by the ledger builder. The P&L calculator
 * fills in {@code status}, {@code grossPnl}, {@code costsAllocated},
 * {@code realizedPnl} and {@code pnlConfidence}. The ledger builder's own
 * verdicts travel in {@code upstreamStatus} and {@code upstreamPnlConfidence}
 * and are never written by the calculator, so a row can be recomputed as new
 * fills arrive.
 */
@Getter
@Setter
@ToString
public class LedgerRow {

    private String intentId;

    private String tradingDate;

    private String stream;

    private String instrument;

    private Direction direction;

    private BigDecimal entryPrice;

    private int entryQty;

    private int exitQty;

    private BigDecimal avgExitPrice;

    private BigDecimal totalCosts = BigDecimal.ZERO;

    private IntentStatus upstreamStatus;

    private PnlConfidence upstreamPnlConfidence;

    private IntentStatus status;

    private BigDecimal grossPnl;

    private BigDecimal costsAllocated = BigDecimal.ZERO;

    private BigDecimal realizedPnl;

    private PnlConfidence pnlConfidence;
}
