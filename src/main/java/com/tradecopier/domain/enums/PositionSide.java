package com.tradecopier.domain.enums;

/**
 * Direction of a position or market order. Mirrors the venue's BUY/SELL trade side: a BUY opens
 * a LONG, a SELL opens a SHORT.
 */
public enum PositionSide {
    LONG,
    SHORT;

    /** Maps the venue's trade side string ("BUY"/"SELL") onto a position side. */
    public static PositionSide fromTradeSide(String tradeSide) {
        if ("BUY".equalsIgnoreCase(tradeSide)) {
            return LONG;
        }
        if ("SELL".equalsIgnoreCase(tradeSide)) {
            return SHORT;
        }
        throw new IllegalArgumentException("Unknown trade side: " + tradeSide);
    }
}
