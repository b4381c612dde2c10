package com.snuffles.ledgerpnl.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class StreamPnlSummary {
    String stream;
    BigDecimal realizedPnl;
    int openPositions;
    BigDecimal totalCostsRealized;
    int intentCount;
    int closedCount;
    int partialCount;
    int openCount;
    PnlConfidence pnlConfidence;

    /**
     * Summary reported when a stream could not be aggregated at all.
     */
    public static StreamPnlSummary empty(String stream) {
        return StreamPnlSummary.builder()
            .stream(stream)
            .realizedPnl(BigDecimal.ZERO)
            .totalCostsRealized(BigDecimal.ZERO)
            .pnlConfidence(PnlConfidence.LOW)
            .build();
    }
}
