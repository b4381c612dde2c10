package com.snuffles.ledgerpnl.domain;

public enum PnlConfidence {
    HIGH, MEDIUM, LOW
}
