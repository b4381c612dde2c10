package com.snuffles.ledgerpnl.service;

import com.snuffles.ledgerpnl.domain.IntentStatus;
import com.snuffles.ledgerpnl.domain.LedgerRow;
import com.snuffles.ledgerpnl.domain.PnlConfidence;
import com.snuffles.ledgerpnl.domain.StreamPnlSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Reduces the computed ledger rows of one stream into a {@link StreamPnlSummary}.
 */
@Service
@Slf4j
public class StreamPnlAggregator {

    public StreamPnlSummary aggregate(List<LedgerRow> rows, String stream) {
        BigDecimal realizedPnl = BigDecimal.ZERO;
        BigDecimal totalCostsRealized = BigDecimal.ZERO;
        int openCount = 0;
        int closedCount = 0;
        int partialCount = 0;

        for (LedgerRow row : rows) {
            IntentStatus status = row.getStatus();
            if (status == null) {
                continue;
            }
            switch (status) {
                case OPEN -> openCount++;
                case CLOSED -> closedCount++;
                case PARTIAL -> partialCount++;
            }
            if (status.isRealized()) {
                if (row.getRealizedPnl() != null) {
                    realizedPnl = realizedPnl.add(row.getRealizedPnl());
                }
                if (row.getCostsAllocated() != null) {
                    totalCostsRealized = totalCostsRealized.add(row.getCostsAllocated());
                }
            }
        }

        StreamPnlSummary summary = StreamPnlSummary.builder()
            .stream(stream)
            .realizedPnl(realizedPnl)
            .openPositions(openCount)
            .totalCostsRealized(totalCostsRealized)
            .intentCount(rows.size())
            .closedCount(closedCount)
            .partialCount(partialCount)
            .openCount(openCount)
            .pnlConfidence(combineConfidence(rows))
            .build();

        log.debug("Aggregated {} intents for stream {}: realized={}, costs={}, confidence={}",
            rows.size(), stream, realizedPnl, totalCostsRealized, summary.getPnlConfidence());
        return summary;
    }

    /**
     * HIGH only if every row is HIGH, else MEDIUM if any row is MEDIUM, else LOW.
     * A stream without rows is LOW. Rows without a confidence count as LOW.
     */
    PnlConfidence combineConfidence(List<LedgerRow> rows) {
        if (rows.isEmpty()) {
            return PnlConfidence.LOW;
        }
        boolean allHigh = rows.stream().allMatch(r -> confidenceOf(r) == PnlConfidence.HIGH);
        if (allHigh) {
            return PnlConfidence.HIGH;
        }
        boolean anyMedium = rows.stream().anyMatch(r -> confidenceOf(r) == PnlConfidence.MEDIUM);
        return anyMedium ? PnlConfidence.MEDIUM : PnlConfidence.LOW;
    }

    private PnlConfidence confidenceOf(LedgerRow row) {
        return row.getPnlConfidence() != null ? row.getPnlConfidence() : PnlConfidence.LOW;
    }
}
