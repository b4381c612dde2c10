package com.snuffles.ledgerpnl.domain;

import lombok.Value;

import java.util.List;

@Value
public class TradingDayPnlReport {
    String tradingDate;
    List<StreamPnlSummary> streams;
}
