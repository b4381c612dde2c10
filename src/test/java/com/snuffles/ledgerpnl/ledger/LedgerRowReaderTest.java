package com.snuffles.ledgerpnl.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.ledgerpnl.domain.Direction;
import com.snuffles.ledgerpnl.domain.IntentStatus;
import com.snuffles.ledgerpnl.domain.LedgerRow;
import com.snuffles.ledgerpnl.domain.PnlConfidence;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerRowReaderTest {

    private LedgerRowReader reader;

    @BeforeEach
    void init() {
        reader = new LedgerRowReader(new ObjectMapper(), new LedgerRowMapperImpl());
    }

    @Test
    void readSkipsInvalidRows() {
        List<LedgerRow> rows = reader.read(new ClassPathResource("ledger/sample-ledger.json"));

        assertThat(rows).extracting(LedgerRow::getIntentId)
            .containsExactly("a1f3c9e2", "b7d04411", "c22e8f90", "d9a17b3c");
    }

    @Test
    void readMapsCanonicalFields() {
        List<LedgerRow> rows = reader.read(new ClassPathResource("ledger/sample-ledger.json"));

        LedgerRow partial = rows.get(1);
        assertThat(partial.getDirection()).isEqualTo(Direction.Short);
        assertThat(partial.getEntryQty()).isEqualTo(4);
        assertThat(partial.getExitQty()).isEqualTo(1);
        assertThat(partial.getUpstreamStatus()).isEqualTo(IntentStatus.PARTIAL);
        assertThat(partial.getUpstreamPnlConfidence()).isEqualTo(PnlConfidence.MEDIUM);

        LedgerRow open = rows.get(2);
        assertThat(open.getInstrument()).isNull();
        assertThat(open.getExitQty()).isZero();
        assertThat(open.getAvgExitPrice()).isNull();
    }

    @Test
    void readRejectsExitQtyAboveEntryQty() {
        String json = """
            [{"intent_id": "x", "stream": "ES1", "direction": "Long",
              "entry_price": 100, "entry_qty": 1, "exit_qty": 2, "avg_exit_price": 101}]
            """;

        List<LedgerRow> rows = reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertThat(rows).isEmpty();
    }

    @Test
    void readFailsOnUnparseableDocument() {
        assertThatThrownBy(() -> reader.read(new ClassPathResource("ledger/broken-ledger.json")))
            .isInstanceOf(LedgerReadException.class);
    }

    @Test
    void readFailsOnMissingResource() {
        assertThatThrownBy(() -> reader.read(new ClassPathResource("ledger/absent.json")))
            .isInstanceOf(LedgerReadException.class)
            .hasMessageContaining("absent.json");
    }
}
