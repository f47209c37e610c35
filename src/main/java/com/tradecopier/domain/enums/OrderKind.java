package com.tradecopier.domain.enums;

public enum OrderKind {
    MARKET_OPEN,
    CLOSE_POSITION
}
