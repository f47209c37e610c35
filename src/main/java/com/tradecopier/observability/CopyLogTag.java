package com.tradecopier.observability;

/** Leading tag of a copy log line, e.g. {@code [OPEN]}. */
public enum CopyLogTag {
    OPEN,
    ADJUST,
    CLOSE,
    VOLUME,
    RECONCILE,
    ERROR;

    public String bracketed() {
        return "[" + name() + "]";
    }
}
