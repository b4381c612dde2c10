package com.snuffles.ledgerpnl.service;

import com.snuffles.ledgerpnl.domain.Direction;
import com.snuffles.ledgerpnl.domain.InstrumentResolution;
import com.snuffles.ledgerpnl.domain.IntentStatus;
import com.snuffles.ledgerpnl.domain.LedgerRow;
import com.snuffles.ledgerpnl.domain.PnlConfidence;
import com.snuffles.ledgerpnl.service.exception.MalformedLedgerRowException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Realized P&L for a single intent.
 * <p>
 * Costs are realized in proportion to the quantity closed out: a CLOSED intent
 * carries all of its {@code totalCosts}, a PARTIAL one carries
 * {@code totalCosts * exitQty / entryQty}, an OPEN one carries none. Status and
 * confidence supplied upstream are kept; they are only derived when absent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentPnlCalculator {

    static final int MONEY_SCALE = 4;

    private final InstrumentResolver instrumentResolver;

    public LedgerRow computeIntentPnl(LedgerRow row) {
        InstrumentResolution resolution = instrumentResolver.resolve(row);

        if (resolution.getWarning() != null) {
            log.warn("Intent {} on stream {} priced with multiplier 1 ({} for instrument {})",
                row.getIntentId(), row.getStream(), resolution.getWarning(), resolution.getInstrument());
        }

        IntentStatus status = row.getUpstreamStatus() != null
            ? row.getUpstreamStatus()
            : IntentStatus.of(row.getExitQty(), row.getEntryQty(), row.getAvgExitPrice());
        row.setStatus(status);

        if (status == IntentStatus.OPEN || row.getAvgExitPrice() == null || row.getExitQty() == 0) {
            row.setGrossPnl(null);
            row.setRealizedPnl(null);
            row.setCostsAllocated(BigDecimal.ZERO);
            row.setPnlConfidence(confidenceOr(row, PnlConfidence.LOW));
            log.trace("Intent {} on {} has no realized exits (status={})", row.getIntentId(), row.getStream(), status);
            return row;
        }

        if (row.getDirection() == null) {
            throw new MalformedLedgerRowException("Intent " + row.getIntentId() + " on " + row.getStream() + " has no direction");
        }
        if (row.getEntryPrice() == null) {
            throw new MalformedLedgerRowException("Intent " + row.getIntentId() + " on " + row.getStream() + " has no entry price");
        }

        BigDecimal priceDiff = row.getAvgExitPrice().subtract(row.getEntryPrice());
        if (row.getDirection() == Direction.Short) {
            priceDiff = priceDiff.negate();
        }

        BigDecimal grossPnl = priceDiff
            .multiply(BigDecimal.valueOf(row.getExitQty()))
            .multiply(resolution.getMultiplier());
        BigDecimal costsAllocated = allocateCosts(row, status);

        row.setGrossPnl(grossPnl);
        row.setCostsAllocated(costsAllocated);
        row.setRealizedPnl(grossPnl.subtract(costsAllocated));
        row.setPnlConfidence(confidenceOr(row, PnlConfidence.HIGH));

        log.debug(
            "Intent {} on {} ({} {}): status={}, multiplier={}, gross={}, costs={}, realized={}",
            row.getIntentId(),
            row.getStream(),
            row.getDirection(),
            resolution.getInstrument(),
            status,
            resolution.getMultiplier(),
            grossPnl,
            costsAllocated,
            row.getRealizedPnl()
        );
        return row;
    }

    private PnlConfidence confidenceOr(LedgerRow row, PnlConfidence computed) {
        return row.getUpstreamPnlConfidence() != null ? row.getUpstreamPnlConfidence() : computed;
    }

    private BigDecimal allocateCosts(LedgerRow row, IntentStatus status) {
        BigDecimal totalCosts = row.getTotalCosts() != null ? row.getTotalCosts() : BigDecimal.ZERO;
        return switch (status) {
            case CLOSED -> totalCosts;
            case PARTIAL -> row.getEntryQty() > 0
                ? totalCosts
                    .multiply(BigDecimal.valueOf(row.getExitQty()))
                    .divide(BigDecimal.valueOf(row.getEntryQty()), MONEY_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
            default -> BigDecimal.ZERO;
        };
    }
}
