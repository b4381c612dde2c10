package com.snuffles.ledgerpnl.domain;

public enum Direction {
    Long, Short
}
