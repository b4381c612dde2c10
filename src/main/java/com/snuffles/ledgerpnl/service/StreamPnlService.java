package com.snuffles.ledgerpnl.service;

import com.snuffles.ledgerpnl.domain.LedgerRow;
import com.snuffles.ledgerpnl.domain.PnlConfidence;
import com.snuffles.ledgerpnl.domain.StreamPnlSummary;
import com.snuffles.ledgerpnl.domain.TradingDayPnlReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Computes intent P&L for a trading day's ledger rows and rolls it up per stream.
 * A row that cannot be computed is reported with LOW confidence and no realized
 * P&L; it never prevents the rest of its stream from being summarized.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreamPnlService {

    private final IntentPnlCalculator intentPnlCalculator;
    private final StreamPnlAggregator streamPnlAggregator;

    public TradingDayPnlReport summarizeTradingDay(String tradingDate, List<LedgerRow> rows) {
        rows.forEach(this::computeSafely);

        Map<String, List<LedgerRow>> byStream = rows.stream()
            .filter(row -> row.getStream() != null && !row.getStream().isBlank())
            .collect(Collectors.groupingBy(LedgerRow::getStream, TreeMap::new, Collectors.toList()));

        List<StreamPnlSummary> summaries = byStream.entrySet().stream()
            .map(entry -> aggregateSafely(entry.getValue(), entry.getKey()))
            .toList();

        log.info("Summarized {} intents across {} streams for {}", rows.size(), summaries.size(), tradingDate);
        return new TradingDayPnlReport(tradingDate, summaries);
    }

    public StreamPnlSummary summarizeStream(String tradingDate, List<LedgerRow> rows, String stream) {
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("Stream id is required to summarize a stream");
        }
        List<LedgerRow> streamRows = rows.stream()
            .filter(row -> stream.equals(row.getStream()))
            .toList();
        streamRows.forEach(this::computeSafely);

        StreamPnlSummary summary = aggregateSafely(streamRows, stream);
        log.debug("Summarized stream {} for {}: {} intents, realized={}",
            stream, tradingDate, summary.getIntentCount(), summary.getRealizedPnl());
        return summary;
    }

    private void computeSafely(LedgerRow row) {
        try {
            intentPnlCalculator.computeIntentPnl(row);
        } catch (RuntimeException ex) {
            log.warn("Skipping P&L for intent {} on stream {}: {}", row.getIntentId(), row.getStream(), ex.getMessage());
            row.setGrossPnl(null);
            row.setRealizedPnl(null);
            row.setCostsAllocated(BigDecimal.ZERO);
            row.setPnlConfidence(PnlConfidence.LOW);
        }
    }

    private StreamPnlSummary aggregateSafely(List<LedgerRow> rows, String stream) {
        try {
            return streamPnlAggregator.aggregate(rows, stream);
        } catch (RuntimeException ex) {
            log.error("Error aggregating P&L for stream {}", stream, ex);
            return StreamPnlSummary.empty(stream);
        }
    }
}
