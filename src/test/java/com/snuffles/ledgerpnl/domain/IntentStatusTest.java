package com.snuffles.ledgerpnl.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class IntentStatusTest {

    @Test
    void statusFollowsQuantitiesAndExitPrice() {
        Random random = new Random(20240115L);

        for (int i = 0; i < 1_000; i++) {
            int entryQty = 1 + random.nextInt(10);
            int exitQty = random.nextInt(entryQty + 1);
            BigDecimal avgExitPrice = random.nextInt(4) == 0
                ? null
                : BigDecimal.valueOf(random.nextInt(1_000_000), 2);

            IntentStatus expected;
            if (exitQty == 0 || avgExitPrice == null) {
                expected = IntentStatus.OPEN;
            } else if (exitQty >= entryQty) {
                expected = IntentStatus.CLOSED;
            } else {
                expected = IntentStatus.PARTIAL;
            }

            assertThat(IntentStatus.of(exitQty, entryQty, avgExitPrice))
                .as("entryQty=%d exitQty=%d avgExitPrice=%s", entryQty, exitQty, avgExitPrice)
                .isEqualTo(expected);
        }
    }

    @Test
    void exitPriceWithoutExitQtyIsOpen() {
        assertThat(IntentStatus.of(0, 2, new BigDecimal("101.25"))).isEqualTo(IntentStatus.OPEN);
    }

    @Test
    void onlyPartialAndClosedAreRealized() {
        assertThat(IntentStatus.OPEN.isRealized()).isFalse();
        assertThat(IntentStatus.PARTIAL.isRealized()).isTrue();
        assertThat(IntentStatus.CLOSED.isRealized()).isTrue();
    }
}
