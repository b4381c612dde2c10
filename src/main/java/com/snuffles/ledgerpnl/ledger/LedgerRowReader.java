package com.snuffles.ledgerpnl.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.ledgerpnl.domain.Direction;
import com.snuffles.ledgerpnl.domain.IntentStatus;
import com.snuffles.ledgerpnl.domain.LedgerRow;
import com.snuffles.ledgerpnl.domain.PnlConfidence;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Reads ledger rows, as written by the ledger builder, from a JSON array.
 * Rows that cannot describe a valid intent are skipped with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerRowReader {

    private final ObjectMapper objectMapper;
    private final LedgerRowMapper ledgerRowMapper;

    public List<LedgerRow> read(Resource resource) {
        try (InputStream inputStream = resource.getInputStream()) {
            return read(inputStream);
        } catch (IOException e) {
            throw new LedgerReadException("Failed to open ledger " + resource.getDescription(), e);
        }
    }

    public List<LedgerRow> read(InputStream inputStream) {
        List<LedgerRowRecord> records;
        try {
            records = objectMapper.readValue(inputStream, new TypeReference<List<LedgerRowRecord>>() {});
        } catch (IOException e) {
            throw new LedgerReadException("Failed to parse ledger rows", e);
        }

        List<LedgerRow> rows = records.stream()
            .filter(Objects::nonNull)
            .filter(this::isValidRecord)
            .map(ledgerRowMapper::toLedgerRow)
            .toList();
        log.debug("Read {} of {} ledger rows", rows.size(), records.size());
        return rows;
    }

    private boolean isValidRecord(LedgerRowRecord record) {
        if (record.entryPrice() == null || record.entryPrice().compareTo(BigDecimal.ZERO) <= 0) {
            log.warn("Skipping ledger row with invalid entry_price: {}", record);
            return false;
        }

        if (record.entryQty() == null || record.entryQty() <= 0) {
            log.warn("Skipping ledger row with invalid entry_qty: {}", record);
            return false;
        }

        int exitQty = record.exitQty() != null ? record.exitQty() : 0;
        if (exitQty < 0 || exitQty > record.entryQty()) {
            log.warn("Skipping ledger row with exit_qty outside [0, entry_qty]: {}", record);
            return false;
        }

        if (!isEnumValue(Direction.class, record.direction())) {
            log.warn("Skipping ledger row with invalid direction '{}': {}", record.direction(), record);
            return false;
        }

        if (!isEnumValue(IntentStatus.class, record.status())) {
            log.warn("Skipping ledger row with invalid status '{}': {}", record.status(), record);
            return false;
        }

        if (!isEnumValue(PnlConfidence.class, record.pnlConfidence())) {
            log.warn("Skipping ledger row with invalid pnl_confidence '{}': {}", record.pnlConfidence(), record);
            return false;
        }

        return true;
    }

    // absent values are allowed; the calculator decides what to do with them
    private static <E extends Enum<E>> boolean isEnumValue(Class<E> type, String value) {
        if (value == null) {
            return true;
        }
        try {
            Enum.valueOf(type, value);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
